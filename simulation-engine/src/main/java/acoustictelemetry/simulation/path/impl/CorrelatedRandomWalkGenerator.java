package acoustictelemetry.simulation.path.impl;

import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.exception.BoundaryViolationException;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.BoundaryOracle;
import acoustictelemetry.domain.geometry.BoundingBox;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.geometry.Point;
import acoustictelemetry.simulation.path.PathGenerator;
import acoustictelemetry.simulation.path.TurnAngleDistribution;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Paseo aleatorio correlacionado dentro de una región.
 * <p>
 * Cada paso avanza {@code stepLength} en un rumbo igual al anterior perturbado por un giro
 * aleatorio. Si el segmento propuesto sale de la región se descarta y se vuelve a sortear
 * (muestreo por rechazo). La primera mitad del presupuesto de intentos usa la distribución de
 * giro; la segunda sortea el rumbo uniformemente para poder salir de callejones sin salida
 * (p. ej. de frente contra una orilla con giros muy estrechos). Agotado el presupuesto se
 * lanza {@link BoundaryViolationException}; nunca se devuelve una trayectoria más corta.
 */
@Slf4j
public class CorrelatedRandomWalkGenerator implements PathGenerator {

    private static final double TWO_PI = 2.0 * Math.PI;
    private static final int MAX_START_ATTEMPTS = 10_000;

    @Override
    public Path generatePath(Point start, double stepLength, int stepCount, BoundaryOracle boundary,
                             TurnAngleDistribution turnAngles, Double initialHeading, int maxAttempts, Random random) {
        validate(start, stepLength, stepCount, boundary, turnAngles, maxAttempts, random);
        if (initialHeading != null && !Double.isFinite(initialHeading)) {
            throw new SimulationValidationException("El rumbo inicial no es finito: " + initialHeading);
        }

        if (!boundary.contains(start)) {
            throw new BoundaryViolationException("El punto de inicio está fuera de la región", 0, start, 0);
        }

        double heading = initialHeading != null ? initialHeading : random.nextDouble() * TWO_PI;
        int uniformFallbackFrom = (maxAttempts + 1) / 2;

        List<Point> points = new ArrayList<>(stepCount + 1);
        points.add(start);
        Point current = start;
        long rejected = 0;

        for (int step = 1; step <= stepCount; step++) {
            Point proposal = null;
            boolean accepted = false;

            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                double candidateHeading = attempt < uniformFallbackFrom
                        ? heading + turnAngles.draw(random)
                        : random.nextDouble() * TWO_PI;
                proposal = current.advance(candidateHeading, stepLength);

                if (boundary.containsSegment(current, proposal)) {
                    heading = Math.IEEEremainder(candidateHeading, TWO_PI);
                    accepted = true;
                    break;
                }
                rejected++;
            }

            if (!accepted) {
                throw new BoundaryViolationException(
                        "Presupuesto de reintentos agotado buscando un paso dentro de la región",
                        step, proposal, maxAttempts);
            }
            points.add(proposal);
            current = proposal;
        }

        double rejectionRate = (double) rejected / (rejected + stepCount);
        if (rejectionRate > 0.5) {
            log.warn("Tasa de rechazo alta en el paseo ({} rechazos en {} pasos). ¿Paso demasiado largo para la región?",
                    rejected, stepCount);
        } else {
            log.debug("Trayectoria generada: {} pasos, {} propuestas rechazadas.", stepCount, rejected);
        }
        return Path.of(points);
    }

    @Override
    public Path generatePath(WalkConfig config, BoundaryOracle boundary, Random random) {
        if (config == null) {
            throw new SimulationValidationException("Falta la configuración del paseo.");
        }
        if (boundary == null || random == null) {
            throw new SimulationValidationException("El paseo necesita una región y un generador aleatorio.");
        }
        Point start = config.getStart() != null ? config.getStart() : randomStart(boundary, random);
        Double heading = config.getInitialHeadingDegrees() != null
                ? Math.toRadians(config.getInitialHeadingDegrees())
                : null;
        TurnAngleDistribution turns = TurnAngleDistribution.normal(
                config.getTurnAngleMeanDegrees(), config.getTurnAngleSdDegrees());

        return generatePath(start, config.getStepLength(), config.getStepCount(), boundary, turns,
                heading, config.getMaxAttemptsPerStep(), random);
    }

    /**
     * Sortea un punto uniforme dentro de la región por rechazo sobre su caja envolvente.
     */
    public Point randomStart(BoundaryOracle boundary, Random random) {
        BoundingBox box = boundary.bounds().orElseThrow(() -> new SimulationValidationException(
                "La región no expone su caja envolvente; indique un punto de inicio explícito."));
        Point candidate = null;
        for (int attempt = 0; attempt < MAX_START_ATTEMPTS; attempt++) {
            candidate = box.randomPoint(random);
            if (boundary.contains(candidate)) {
                return candidate;
            }
        }
        throw new BoundaryViolationException("No se encontró un punto de inicio dentro de la región",
                0, candidate, MAX_START_ATTEMPTS);
    }

    private static void validate(Point start, double stepLength, int stepCount, BoundaryOracle boundary,
                                 TurnAngleDistribution turnAngles, int maxAttempts, Random random) {
        if (start == null || !start.isFinite()) {
            throw new SimulationValidationException("Punto de inicio no válido: " + start);
        }
        if (!(stepLength > 0.0) || !Double.isFinite(stepLength)) {
            throw new SimulationValidationException("La longitud de paso debe ser positiva: " + stepLength);
        }
        if (stepCount <= 0) {
            throw new SimulationValidationException("El número de pasos debe ser positivo: " + stepCount);
        }
        if (maxAttempts <= 0) {
            throw new SimulationValidationException("El número de intentos por paso debe ser positivo: " + maxAttempts);
        }
        if (boundary == null || turnAngles == null || random == null) {
            throw new SimulationValidationException("El paseo necesita región, distribución de giro y generador aleatorio.");
        }
    }
}
