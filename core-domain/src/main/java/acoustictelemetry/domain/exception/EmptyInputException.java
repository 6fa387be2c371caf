package acoustictelemetry.domain.exception;

/**
 * Se pidió simular detecciones sin transmisiones o sin receptores.
 * <p>
 * Un resultado vacío sería ambiguo entre "no hubo detecciones" y "no había nada que
 * simular", por eso se aborta.
 */
public class EmptyInputException extends SimulationValidationException {

    public EmptyInputException(String message) {
        super(message);
    }
}
