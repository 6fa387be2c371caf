package acoustictelemetry.config;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import lombok.Builder;
import lombok.With;

/**
 * Descripción declarativa (serializable) de una curva de rango de detección.
 *
 * @param type          Forma de la curva.
 * @param range         Alcance del escalón ({@link Type#THRESHOLD}).
 * @param intercept     Intercepto b0 ({@link Type#LOGISTIC}).
 * @param slope         Pendiente b1 ({@link Type#LOGISTIC}).
 * @param probability   Probabilidad fija ({@link Type#CONSTANT}).
 * @param distances     Distancias de la tabla ({@link Type#TABLE}).
 * @param probabilities Probabilidades de la tabla ({@link Type#TABLE}).
 */
@Builder
@With
public record DetectionRangeConfig(
        Type type,
        double range,
        double intercept,
        double slope,
        double probability,
        double[] distances,
        double[] probabilities
) {

    public enum Type {
        CONSTANT,
        THRESHOLD,
        LOGISTIC,
        TABLE
    }

    public DetectionRangeFunction toFunction() {
        if (type == null) {
            throw new SimulationValidationException("La curva de rango de detección no declara su tipo.");
        }
        return switch (type) {
            case CONSTANT -> DetectionRangeFunction.constant(probability);
            case THRESHOLD -> DetectionRangeFunction.threshold(range);
            case LOGISTIC -> DetectionRangeFunction.logistic(intercept, slope);
            case TABLE -> DetectionRangeFunction.piecewiseLinear(distances, probabilities);
        };
    }
}
