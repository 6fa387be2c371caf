package acoustictelemetry.domain.exception;

/**
 * Entrada inválida para la simulación: campos ausentes o mal formados, parámetros fuera
 * de rango (paso o velocidad no positivos), o una función de rango de detección que
 * devuelve valores fuera de [0, 1].
 * <p>
 * Nunca se recupera localmente; se propaga al llamador.
 */
public class SimulationValidationException extends IllegalArgumentException {

    public SimulationValidationException(String message) {
        super(message);
    }

    public SimulationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
