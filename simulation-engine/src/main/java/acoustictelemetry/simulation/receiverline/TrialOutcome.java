package acoustictelemetry.simulation.receiverline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resultado de un ensayo: un animal que cruza la línea de receptores.
 *
 * @param trialIndex            Índice del ensayo (desde 0).
 * @param transmissionCount     Transmisiones emitidas durante el cruce.
 * @param detectionCount        Detecciones totales (todas las parejas transmisión-receptor).
 * @param detectionsPerReceiver Detecciones por id de receptor, incluidos los receptores sin detecciones.
 * @param firstDetectionTime    Tiempo de la primera detección, o {@code null} si no se detectó.
 * @param lastDetectionTime     Tiempo de la última detección, o {@code null} si no se detectó.
 */
public record TrialOutcome(
        int trialIndex,
        int transmissionCount,
        int detectionCount,
        Map<Integer, Integer> detectionsPerReceiver,
        Double firstDetectionTime,
        Double lastDetectionTime
) {

    public TrialOutcome {
        detectionsPerReceiver = Collections.unmodifiableMap(new LinkedHashMap<>(detectionsPerReceiver));
    }

    public boolean detected() {
        return detectionCount > 0;
    }
}
