package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.domain.telemetry.DelayRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Valores a barrer. Una lista vacía (o nula) significa "usar el valor base".
 * El barrido es el producto cartesiano, con la separación como bucle más externo para
 * poder reutilizar la región entre velocidades y retardos.
 */
public record SweepParameters(List<Double> spacings, List<Double> velocities, List<DelayRange> delayRanges) {

    public SweepParameters {
        spacings = spacings == null ? List.of() : List.copyOf(spacings);
        velocities = velocities == null ? List.of() : List.copyOf(velocities);
        delayRanges = delayRanges == null ? List.of() : List.copyOf(delayRanges);
    }

    public static SweepParameters ofSpacings(Double... spacings) {
        return new SweepParameters(List.of(spacings), List.of(), List.of());
    }

    public List<SweepPoint> points(ReceiverLineConfig baseLine, TransmitterConfig baseTransmitter) {
        List<Double> s = spacings.isEmpty() ? List.of(baseLine.getSpacing()) : spacings;
        List<Double> v = velocities.isEmpty() ? List.of(baseTransmitter.velocity()) : velocities;
        List<DelayRange> d = delayRanges.isEmpty() ? List.of(baseTransmitter.delayRange()) : delayRanges;

        List<SweepPoint> points = new ArrayList<>(s.size() * v.size() * d.size());
        for (double spacing : s) {
            for (double velocity : v) {
                for (DelayRange delay : d) {
                    points.add(new SweepPoint(spacing, velocity, delay));
                }
            }
        }
        return points;
    }
}
