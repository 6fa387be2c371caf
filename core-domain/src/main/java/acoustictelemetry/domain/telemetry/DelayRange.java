package acoustictelemetry.domain.telemetry;

import acoustictelemetry.domain.exception.SimulationValidationException;

/**
 * Rango [min, max] del retardo entre transmisiones de un emisor, en segundos.
 */
public record DelayRange(double min, double max) {

    public DelayRange {
        if (!(min > 0.0) || !(max >= min) || !Double.isFinite(max)) {
            throw new SimulationValidationException(
                    String.format("Rango de retardo inválido [%s, %s]: se requiere 0 < min <= max.", min, max));
        }
    }

    public static DelayRange of(double min, double max) {
        return new DelayRange(min, max);
    }

    public double mean() {
        return (min + max) / 2.0;
    }

    public double width() {
        return max - min;
    }
}
