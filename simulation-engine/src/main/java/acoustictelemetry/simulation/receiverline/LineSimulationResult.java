package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.simulation.RunStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agregado de los ensayos de cruce de una configuración.
 *
 * @param status          {@link RunStatus#CANCELLED} si faltan ensayos por cancelación.
 * @param requestedTrials Ensayos solicitados.
 * @param outcomes        Ensayos completados, ordenados por índice.
 */
public record LineSimulationResult(RunStatus status, int requestedTrials, List<TrialOutcome> outcomes) {

    public LineSimulationResult {
        outcomes = List.copyOf(outcomes);
    }

    @JsonProperty("completedTrials")
    public int completedTrials() {
        return outcomes.size();
    }

    @JsonProperty("detectedTrials")
    public int detectedTrials() {
        return (int) outcomes.stream().filter(TrialOutcome::detected).count();
    }

    /**
     * Fracción de animales detectados al menos una vez. NaN si no se completó ningún ensayo.
     */
    @JsonProperty("detectionEfficiency")
    public double detectionEfficiency() {
        if (outcomes.isEmpty()) {
            return Double.NaN;
        }
        return (double) detectedTrials() / outcomes.size();
    }

    @JsonProperty("meanDetectionsPerTrial")
    public double meanDetectionsPerTrial() {
        return outcomes.stream().mapToInt(TrialOutcome::detectionCount).average().orElse(Double.NaN);
    }

    /**
     * Detecciones totales por receptor, sumadas sobre todos los ensayos.
     */
    @JsonProperty("detectionsPerReceiver")
    public Map<Integer, Integer> detectionsPerReceiver() {
        Map<Integer, Integer> totals = new LinkedHashMap<>();
        for (TrialOutcome outcome : outcomes) {
            outcome.detectionsPerReceiver().forEach((id, count) -> totals.merge(id, count, Integer::sum));
        }
        return totals;
    }

    public boolean isComplete() {
        return status == RunStatus.COMPLETED;
    }
}
