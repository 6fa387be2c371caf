package acoustictelemetry.simulation;

/**
 * Recibe el avance de ejecuciones largas. Puede invocarse desde hilos de trabajo, por lo que
 * las implementaciones deben ser seguras ante concurrencia.
 */
@FunctionalInterface
public interface SimulationProgressListener {

    void onProgress(int completed, int total);

    static SimulationProgressListener none() {
        return (completed, total) -> { };
    }
}
