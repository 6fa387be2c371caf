package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.domain.telemetry.Receiver;
import acoustictelemetry.factory.ReceiverArrangementFactory;
import acoustictelemetry.simulation.CancellationToken;
import acoustictelemetry.simulation.RunStatus;
import acoustictelemetry.simulation.SimulationProgressListener;
import acoustictelemetry.simulation.detection.DetectionSimulator;
import acoustictelemetry.simulation.path.PathGenerator;
import acoustictelemetry.simulation.path.impl.CorrelatedRandomWalkGenerator;
import acoustictelemetry.simulation.transmission.TransmissionScheduler;
import acoustictelemetry.simulation.transmission.impl.PathTransmissionScheduler;
import acoustictelemetry.utils.SeedSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orquestador de ensayos de cruce de una línea (o rejilla) de receptores.
 * <p>
 * Responsabilidades:
 * 1. Repetir N ensayos independientes (trayectoria → transmisiones → detecciones).
 * 2. Repartirlos en el pool de hilos con semillas derivadas del índice de ensayo, de modo que
 *    el resultado no depende del número de hilos.
 * 3. Consultar la cancelación entre ensayos y devolver resultados parciales con su estado.
 * 4. Barrer separación, velocidad y retardo reutilizando la región mientras no cambie.
 */
@Slf4j
public class ReceiverLineSimulator implements AutoCloseable {

    @Getter
    private final int workerCount;
    private final PathGenerator pathGenerator;
    private final TransmissionScheduler scheduler;
    private final DetectionSimulator detectionSimulator;
    private final ExecutorService threadPool;

    public ReceiverLineSimulator(int workerCount) {
        this(workerCount, new CorrelatedRandomWalkGenerator(), new PathTransmissionScheduler());
    }

    public ReceiverLineSimulator(int workerCount, PathGenerator pathGenerator, TransmissionScheduler scheduler) {
        if (workerCount < 1) {
            throw new SimulationValidationException("El número de hilos debe ser al menos 1: " + workerCount);
        }
        this.workerCount = workerCount;
        this.pathGenerator = pathGenerator;
        this.scheduler = scheduler;
        // Los ensayos ya se reparten entre hilos; dentro de cada uno la detección es secuencial
        this.detectionSimulator = new DetectionSimulator(1);
        this.threadPool = workerCount > 1 ? Executors.newFixedThreadPool(workerCount) : null;
        log.info("ReceiverLineSimulator inicializado. (Hilos: {})", workerCount);
    }

    public LineSimulationResult simulate(ReceiverLineScenario scenario, int trials, long seed) {
        return simulate(scenario, trials, seed, CancellationToken.none(), SimulationProgressListener.none());
    }

    /**
     * Ejecuta {@code trials} ensayos independientes sobre el escenario.
     *
     * @return Resultado con los ensayos completados en orden de índice y estado
     * {@link RunStatus#CANCELLED} si la cancelación impidió completar alguno.
     */
    public LineSimulationResult simulate(ReceiverLineScenario scenario, int trials, long seed,
                                         CancellationToken cancellation, SimulationProgressListener progress) {
        validateScenario(scenario);
        if (trials < 1) {
            throw new SimulationValidationException("El número de ensayos debe ser positivo: " + trials);
        }
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        SimulationProgressListener listener = progress != null ? progress : SimulationProgressListener.none();

        long startTime = System.currentTimeMillis();
        List<CrossingTrialTask> tasks = new ArrayList<>(trials);
        for (int i = 0; i < trials; i++) {
            tasks.add(new CrossingTrialTask(scenario, i, SeedSequence.derive(seed, i), token,
                    pathGenerator, scheduler, detectionSimulator));
        }

        List<TrialOutcome> outcomes = threadPool == null
                ? runSequential(tasks, token, listener)
                : runParallel(tasks, listener);

        RunStatus status = outcomes.size() < trials ? RunStatus.CANCELLED : RunStatus.COMPLETED;
        LineSimulationResult result = new LineSimulationResult(status, trials, outcomes);

        if (status == RunStatus.CANCELLED) {
            log.warn("Simulación de cruce cancelada: {} de {} ensayos completados.", outcomes.size(), trials);
        } else {
            log.info("Simulación de cruce finalizada: {} ensayos, eficiencia {} ({} ms).",
                    trials, String.format(Locale.ROOT, "%.3f", result.detectionEfficiency()), System.currentTimeMillis() - startTime);
        }
        return result;
    }

    /**
     * Barrido de parámetros sobre una línea regular de receptores.
     * <p>
     * La región y los receptores se derivan una vez por separación y se reutilizan para todas
     * las velocidades y retardos. Todos los puntos usan la misma semilla (números aleatorios
     * comunes), así las diferencias entre puntos no se deben al azar de las trayectorias.
     */
    public SweepResult sweep(ReceiverLineConfig line, WalkConfig walk, TransmitterConfig transmitter,
                             DetectionRangeFunction detectionRange, SweepParameters parameters, long seed,
                             CancellationToken cancellation, SimulationProgressListener progress) {
        if (line == null || transmitter == null || parameters == null) {
            throw new SimulationValidationException("El barrido necesita línea base, transmisor base y parámetros.");
        }
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        List<SweepPoint> points = parameters.points(line, transmitter);
        log.info("Iniciando barrido de {} puntos x {} ensayos.", points.size(), line.getTrialCount());

        List<SweepResult.Entry> entries = new ArrayList<>(points.size());
        ReceiverLineScenario regionScenario = null;
        double regionSpacing = Double.NaN;

        for (SweepPoint point : points) {
            if (token.isCancelled()) {
                break;
            }
            if (regionScenario == null || Double.compare(regionSpacing, point.spacing()) != 0) {
                ReceiverLineConfig pointLine = line.withSpacing(point.spacing());
                List<Receiver> receivers = ReceiverArrangementFactory.fromConfig(pointLine);
                regionScenario = ReceiverLineScenario.forArrangement(receivers, pointLine, walk, transmitter, detectionRange);
                regionSpacing = point.spacing();
                log.debug("Región derivada para separación {}.", point.spacing());
            }

            TransmitterConfig pointTransmitter = transmitter
                    .withVelocity(point.velocity())
                    .withMinDelay(point.delayRange().min())
                    .withMaxDelay(point.delayRange().max());
            ReceiverLineScenario scenario = regionScenario.withTransmitter(pointTransmitter);

            LineSimulationResult result = simulate(scenario, line.getTrialCount(), seed, token, progress);
            entries.add(new SweepResult.Entry(point, result));
            if (!result.isComplete()) {
                break;
            }
        }

        boolean complete = entries.size() == points.size()
                && entries.stream().allMatch(e -> e.result().isComplete());
        return new SweepResult(complete ? RunStatus.COMPLETED : RunStatus.CANCELLED, entries);
    }

    /**
     * Mayor separación cuya eficiencia de detección alcanza {@code target}, considerando solo
     * puntos completos. Vacío si ninguna la alcanza.
     */
    public static OptionalDouble spacingForTargetEfficiency(SweepResult sweep, double target) {
        return sweep.entries().stream()
                .filter(e -> e.result().isComplete())
                .filter(e -> e.result().detectionEfficiency() >= target)
                .mapToDouble(e -> e.point().spacing())
                .max();
    }

    private List<TrialOutcome> runSequential(List<CrossingTrialTask> tasks, CancellationToken token,
                                             SimulationProgressListener listener) {
        List<TrialOutcome> outcomes = new ArrayList<>(tasks.size());
        for (CrossingTrialTask task : tasks) {
            if (token.isCancelled()) {
                break;
            }
            TrialOutcome outcome = task.call();
            if (outcome == null) {
                break;
            }
            outcomes.add(outcome);
            listener.onProgress(outcomes.size(), tasks.size());
        }
        return outcomes;
    }

    private List<TrialOutcome> runParallel(List<CrossingTrialTask> tasks, SimulationProgressListener listener) {
        AtomicInteger completed = new AtomicInteger();
        int total = tasks.size();
        List<Callable<TrialOutcome>> wrapped = new ArrayList<>(total);
        for (CrossingTrialTask task : tasks) {
            wrapped.add(() -> {
                TrialOutcome outcome = task.call();
                if (outcome != null) {
                    listener.onProgress(completed.incrementAndGet(), total);
                }
                return outcome;
            });
        }

        List<Future<TrialOutcome>> futures;
        try {
            futures = threadPool.invokeAll(wrapped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulación de cruce interrumpida.", e);
        }

        List<TrialOutcome> outcomes = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            TrialOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Simulación de cruce interrumpida.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw new IllegalStateException("Error en el ensayo " + i, e.getCause());
            }
            if (outcome != null) {
                outcomes.add(outcome);
            }
        }
        return outcomes;
    }

    private static void validateScenario(ReceiverLineScenario scenario) {
        if (scenario == null) {
            throw new SimulationValidationException("Falta el escenario de cruce.");
        }
        if (scenario.getRegion() == null || scenario.getReceivers() == null || scenario.getReceivers().isEmpty()
                || scenario.getWalk() == null || scenario.getTransmitter() == null
                || scenario.getDetectionRange() == null) {
            throw new SimulationValidationException(
                    "El escenario de cruce está incompleto (región, receptores, paseo, transmisor y curva son obligatorios).");
        }
        if (!(scenario.getStartMaxX() >= scenario.getStartMinX())) {
            throw new SimulationValidationException("Tramo de salida inválido en el escenario de cruce.");
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        detectionSimulator.close();
        log.info("ReceiverLineSimulator cerrado.");
    }
}
