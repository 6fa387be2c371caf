package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.simulation.RunStatus;

import java.util.List;

/**
 * Resultado de un barrido de parámetros.
 *
 * @param status  {@link RunStatus#CANCELLED} si el barrido se detuvo antes de terminar.
 * @param entries Puntos evaluados, en orden de barrido. El último puede estar incompleto.
 */
public record SweepResult(RunStatus status, List<Entry> entries) {

    public SweepResult {
        entries = List.copyOf(entries);
    }

    public record Entry(SweepPoint point, LineSimulationResult result) {
    }
}
