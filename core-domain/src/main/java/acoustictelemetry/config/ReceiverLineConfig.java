package acoustictelemetry.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Disposición de una línea (o rejilla) de receptores y del experimento de cruce.
 */
@Value
@Builder
@With
@Jacksonized
public class ReceiverLineConfig {

    @Builder.Default
    Layout layout = Layout.LINE;

    /**
     * Receptores por fila.
     */
    @Builder.Default
    int receiverCount = 10;

    /**
     * Filas de la rejilla. En {@link Layout#LINE} se ignora.
     */
    @Builder.Default
    int gridRows = 1;

    /**
     * Separación entre receptores contiguos.
     */
    double spacing;

    /**
     * Extensión de la región más allá de los receptores extremos, a ambos lados de la línea.
     * Negativo = usar la separación.
     */
    @Builder.Default
    double margin = -1.0;

    /**
     * Distancia perpendicular desde la línea hasta el borde de la región (lado de salida y de llegada).
     */
    @Builder.Default
    double crossingDistance = 1000.0;

    /**
     * Número de animales simulados (ensayos independientes).
     */
    @Builder.Default
    int trialCount = 100;

    public double effectiveMargin() {
        return margin < 0 ? spacing : margin;
    }

    public enum Layout {
        LINE,
        GRID
    }
}
