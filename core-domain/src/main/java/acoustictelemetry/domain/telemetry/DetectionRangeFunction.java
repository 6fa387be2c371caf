package acoustictelemetry.domain.telemetry;

import acoustictelemetry.domain.exception.SimulationValidationException;

import java.util.Arrays;

/**
 * Curva de rango de detección: probabilidad de detectar una señal en función de la
 * distancia transmisor-receptor.
 * <p>
 * Debe devolver un valor en [0, 1] para toda distancia no negativa. Por convención es
 * no creciente, pero el motor no asume monotonía.
 */
@FunctionalInterface
public interface DetectionRangeFunction {

    double probabilityAt(double distance);

    /**
     * Probabilidad constante, independiente de la distancia.
     */
    static DetectionRangeFunction constant(double probability) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new SimulationValidationException("Probabilidad fuera de [0, 1]: " + probability);
        }
        return distance -> probability;
    }

    /**
     * Escalón: 1 hasta {@code range} (incluido), 0 más allá.
     */
    static DetectionRangeFunction threshold(double range) {
        if (!(range >= 0.0)) {
            throw new SimulationValidationException("El rango del escalón debe ser no negativo: " + range);
        }
        return distance -> distance <= range ? 1.0 : 0.0;
    }

    /**
     * Curva logística {@code p(d) = 1 / (1 + exp(-(b0 + b1 * d)))}.
     * Con pendiente negativa la probabilidad decae con la distancia.
     */
    static DetectionRangeFunction logistic(double intercept, double slope) {
        return distance -> 1.0 / (1.0 + Math.exp(-(intercept + slope * distance)));
    }

    /**
     * Interpolación lineal sobre una tabla (distancia, probabilidad), p. ej. de un ensayo de
     * rango en campo. Fuera de la tabla se mantiene el valor del extremo.
     *
     * @param distances     Distancias estrictamente crecientes.
     * @param probabilities Probabilidades en [0, 1], una por distancia.
     */
    static DetectionRangeFunction piecewiseLinear(double[] distances, double[] probabilities) {
        if (distances == null || probabilities == null || distances.length == 0
                || distances.length != probabilities.length) {
            throw new SimulationValidationException("La tabla de rango necesita el mismo número (>0) de distancias y probabilidades.");
        }
        for (int i = 0; i < distances.length; i++) {
            if (i > 0 && !(distances[i] > distances[i - 1])) {
                throw new SimulationValidationException("Las distancias de la tabla deben ser estrictamente crecientes.");
            }
            if (!(probabilities[i] >= 0.0 && probabilities[i] <= 1.0)) {
                throw new SimulationValidationException("Probabilidad fuera de [0, 1] en la tabla: " + probabilities[i]);
            }
        }
        final double[] d = distances.clone();
        final double[] p = probabilities.clone();
        return distance -> {
            if (distance <= d[0]) return p[0];
            if (distance >= d[d.length - 1]) return p[p.length - 1];
            int idx = Arrays.binarySearch(d, distance);
            if (idx >= 0) return p[idx];
            int upper = -idx - 1;
            int lower = upper - 1;
            double t = (distance - d[lower]) / (d[upper] - d[lower]);
            return p[lower] + t * (p[upper] - p[lower]);
        };
    }
}
