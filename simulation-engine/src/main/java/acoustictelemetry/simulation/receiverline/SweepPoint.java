package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.domain.telemetry.DelayRange;

/**
 * Combinación concreta de parámetros dentro de un barrido.
 */
public record SweepPoint(double spacing, double velocity, DelayRange delayRange) {
}
