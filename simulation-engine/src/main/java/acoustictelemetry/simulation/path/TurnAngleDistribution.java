package acoustictelemetry.simulation.path;

import acoustictelemetry.domain.exception.SimulationValidationException;

import java.util.Random;

/**
 * Distribución del ángulo de giro entre pasos consecutivos del paseo correlacionado.
 * Devuelve radianes; positivo = giro antihorario.
 */
@FunctionalInterface
public interface TurnAngleDistribution {

    double draw(Random random);

    /**
     * Giro normal de media y desviación típica dadas en grados.
     */
    static TurnAngleDistribution normal(double meanDegrees, double sdDegrees) {
        if (!(sdDegrees >= 0.0) || !Double.isFinite(meanDegrees)) {
            throw new SimulationValidationException(
                    String.format("Distribución de giro inválida (media=%s, sd=%s).", meanDegrees, sdDegrees));
        }
        final double mean = Math.toRadians(meanDegrees);
        final double sd = Math.toRadians(sdDegrees);
        return random -> mean + sd * random.nextGaussian();
    }

    /**
     * Giro uniforme en [min, max] grados.
     */
    static TurnAngleDistribution uniform(double minDegrees, double maxDegrees) {
        if (!(maxDegrees >= minDegrees)) {
            throw new SimulationValidationException(
                    String.format("Rango de giro inválido [%s, %s].", minDegrees, maxDegrees));
        }
        final double min = Math.toRadians(minDegrees);
        final double width = Math.toRadians(maxDegrees) - min;
        return random -> min + width * random.nextDouble();
    }

    /**
     * Sin giro: trayectoria rectilínea mientras la frontera lo permita.
     */
    static TurnAngleDistribution none() {
        return random -> 0.0;
    }
}
