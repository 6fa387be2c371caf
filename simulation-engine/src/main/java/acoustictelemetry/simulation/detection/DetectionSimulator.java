package acoustictelemetry.simulation.detection;

import acoustictelemetry.domain.exception.EmptyInputException;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.domain.telemetry.DetectionRecord;
import acoustictelemetry.domain.telemetry.Receiver;
import acoustictelemetry.domain.telemetry.TransmissionEvent;
import acoustictelemetry.simulation.SimulationProgressListener;
import acoustictelemetry.utils.SeedSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulador estocástico de detecciones en una red de receptores.
 * <p>
 * Reparte el trabajo en una {@link ReceiverDetectionTask} por receptor (los receptores son
 * muchos menos que las transmisiones), reúne los resultados parciales en orden de receptor y
 * los ordena de forma estable por tiempo transcurrido. Cada receptor usa una semilla derivada
 * de la semilla maestra, así que la salida es idéntica bit a bit con uno o varios hilos.
 */
@Slf4j
public class DetectionSimulator implements AutoCloseable {

    @Getter
    private final int workerCount;
    private final ExecutorService threadPool;

    public DetectionSimulator() {
        this(1);
    }

    public DetectionSimulator(int workerCount) {
        if (workerCount < 1) {
            throw new SimulationValidationException("El número de hilos debe ser al menos 1: " + workerCount);
        }
        this.workerCount = workerCount;
        this.threadPool = workerCount > 1 ? Executors.newFixedThreadPool(workerCount) : null;
    }

    /**
     * Simula con una semilla aleatoria (se registra en el log para poder reproducir la ejecución).
     */
    public List<DetectionRecord> simulateDetections(List<TransmissionEvent> transmissions, List<Receiver> receivers,
                                                    DetectionRangeFunction detectionRange) {
        long seed = new Random().nextLong();
        log.info("Simulación de detecciones sin semilla explícita; usando semilla {}", seed);
        return simulateDetections(transmissions, receivers, detectionRange, seed);
    }

    public List<DetectionRecord> simulateDetections(List<TransmissionEvent> transmissions, List<Receiver> receivers,
                                                    DetectionRangeFunction detectionRange, long seed) {
        return simulateDetections(transmissions, receivers, detectionRange, seed, SimulationProgressListener.none());
    }

    /**
     * @return Detecciones ordenadas por tiempo ascendente; los empates conservan el orden de
     * receptor y de transmisión.
     * @throws EmptyInputException           si no hay transmisiones o receptores.
     * @throws SimulationValidationException si la curva de rango falta o devuelve valores fuera de [0, 1].
     */
    public List<DetectionRecord> simulateDetections(List<TransmissionEvent> transmissions, List<Receiver> receivers,
                                                    DetectionRangeFunction detectionRange, long seed,
                                                    SimulationProgressListener progress) {
        if (transmissions == null || transmissions.isEmpty()) {
            throw new EmptyInputException("No hay transmisiones que simular.");
        }
        if (receivers == null || receivers.isEmpty()) {
            throw new EmptyInputException("No hay receptores en la red.");
        }
        if (detectionRange == null) {
            throw new SimulationValidationException("Falta la función de rango de detección.");
        }
        SimulationProgressListener listener = progress != null ? progress : SimulationProgressListener.none();

        long startTime = System.currentTimeMillis();
        List<ReceiverDetectionTask> tasks = new ArrayList<>(receivers.size());
        for (int g = 0; g < receivers.size(); g++) {
            tasks.add(new ReceiverDetectionTask(receivers.get(g), transmissions, detectionRange,
                    SeedSequence.derive(seed, g)));
        }

        List<List<DetectionRecord>> partials = threadPool == null
                ? runSequential(tasks, listener)
                : runParallel(tasks, listener);

        List<DetectionRecord> merged = new ArrayList<>();
        for (List<DetectionRecord> partial : partials) {
            merged.addAll(partial);
        }
        // List.sort es estable: los empates mantienen el orden de receptor
        merged.sort(Comparator.comparingDouble(DetectionRecord::elapsedTime));

        log.debug("Detecciones simuladas: {} de {} transmisiones x {} receptores en {} ms.",
                merged.size(), transmissions.size(), receivers.size(), System.currentTimeMillis() - startTime);
        return merged;
    }

    private List<List<DetectionRecord>> runSequential(List<ReceiverDetectionTask> tasks,
                                                      SimulationProgressListener listener) {
        List<List<DetectionRecord>> partials = new ArrayList<>(tasks.size());
        for (int g = 0; g < tasks.size(); g++) {
            partials.add(tasks.get(g).call());
            listener.onProgress(g + 1, tasks.size());
        }
        return partials;
    }

    private List<List<DetectionRecord>> runParallel(List<ReceiverDetectionTask> tasks,
                                                    SimulationProgressListener listener) {
        AtomicInteger completed = new AtomicInteger();
        int total = tasks.size();
        List<Callable<List<DetectionRecord>>> wrapped = new ArrayList<>(total);
        for (ReceiverDetectionTask task : tasks) {
            wrapped.add(() -> {
                List<DetectionRecord> result = task.call();
                listener.onProgress(completed.incrementAndGet(), total);
                return result;
            });
        }

        List<Future<List<DetectionRecord>>> futures;
        try {
            futures = threadPool.invokeAll(wrapped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulación de detecciones interrumpida.", e);
        }

        List<List<DetectionRecord>> partials = new ArrayList<>(total);
        for (int g = 0; g < total; g++) {
            partials.add(await(futures.get(g), tasks.get(g).getReceiver()));
        }
        return partials;
    }

    private static List<DetectionRecord> await(Future<List<DetectionRecord>> future, Receiver receiver) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulación de detecciones interrumpida.", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Error simulando el receptor " + receiver.receiverId(), e.getCause());
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.debug("DetectionSimulator cerrado.");
    }
}
