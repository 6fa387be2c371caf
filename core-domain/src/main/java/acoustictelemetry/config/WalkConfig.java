package acoustictelemetry.config;

import acoustictelemetry.domain.geometry.Point;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Parámetros del paseo aleatorio correlacionado que genera las trayectorias.
 */
@Value
@Builder
@With
@Jacksonized
public class WalkConfig {

    /**
     * Longitud de cada paso, en las mismas unidades que las coordenadas.
     */
    double stepLength;

    /**
     * Número de pasos. La trayectoria resultante tiene {@code stepCount + 1} puntos.
     */
    int stepCount;

    /**
     * Media del ángulo de giro entre pasos consecutivos, en grados.
     */
    @Builder.Default
    double turnAngleMeanDegrees = 0.0;

    /**
     * Desviación típica del ángulo de giro, en grados. Valores bajos dan trayectorias más rectas.
     */
    @Builder.Default
    double turnAngleSdDegrees = 10.0;

    /**
     * Rumbo inicial en grados (desde el eje +x, antihorario). Nulo = aleatorio uniforme.
     */
    Double initialHeadingDegrees;

    /**
     * Punto de partida. Nulo = punto aleatorio dentro de la región.
     */
    Point start;

    /**
     * Intentos máximos por paso antes de declarar la trayectoria imposible.
     */
    @Builder.Default
    int maxAttemptsPerStep = 50;
}
