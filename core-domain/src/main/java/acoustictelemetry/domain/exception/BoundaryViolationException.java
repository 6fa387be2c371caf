package acoustictelemetry.domain.exception;

import acoustictelemetry.domain.geometry.Point;
import lombok.Getter;

import java.util.Locale;

/**
 * La trayectoria no puede mantenerse dentro de la región: el punto de inicio está fuera,
 * o se agotó el presupuesto de reintentos buscando un paso válido.
 */
@Getter
public class BoundaryViolationException extends RuntimeException {

    private final int stepIndex;
    private final Point attemptedPosition;
    private final int attempts;

    public BoundaryViolationException(String message, int stepIndex, Point attemptedPosition, int attempts) {
        super(String.format(Locale.ROOT, "%s (paso %d, posición intentada (%.4f, %.4f), intentos %d)",
                message, stepIndex,
                attemptedPosition != null ? attemptedPosition.x() : Double.NaN,
                attemptedPosition != null ? attemptedPosition.y() : Double.NaN,
                attempts));
        this.stepIndex = stepIndex;
        this.attemptedPosition = attemptedPosition;
        this.attempts = attempts;
    }
}
