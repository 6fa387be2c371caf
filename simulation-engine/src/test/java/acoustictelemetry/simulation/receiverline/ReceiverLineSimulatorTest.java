package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.factory.ReceiverArrangementFactory;
import acoustictelemetry.simulation.CancellationToken;
import acoustictelemetry.simulation.RunStatus;
import acoustictelemetry.simulation.SimulationProgressListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ReceiverLineSimulatorTest {

    private static final ReceiverLineConfig LINE = ReceiverLineConfig.builder()
            .receiverCount(5)
            .spacing(200.0)
            .crossingDistance(300.0)
            .trialCount(20)
            .build();

    private static final WalkConfig WALK = WalkConfig.builder()
            .stepLength(25.0)
            .turnAngleSdDegrees(10.0)
            .build();

    private static final TransmitterConfig TRANSMITTER = TransmitterConfig.builder()
            .velocity(1.0)
            .minDelay(20.0)
            .maxDelay(40.0)
            .burstDuration(3.0)
            .build();

    private ReceiverLineSimulator sequential;
    private ReceiverLineSimulator parallel;

    @BeforeEach
    void setUp() {
        sequential = new ReceiverLineSimulator(1);
        parallel = new ReceiverLineSimulator(4);
    }

    @AfterEach
    void tearDown() {
        sequential.close();
        parallel.close();
    }

    private static ReceiverLineScenario scenario(DetectionRangeFunction range) {
        return ReceiverLineScenario.forArrangement(
                ReceiverArrangementFactory.fromConfig(LINE), LINE, WALK, TRANSMITTER, range);
    }

    @Test
    @DisplayName("Detección segura: eficiencia 1 y todas las transmisiones detectadas por cada receptor")
    void certainDetection_fullEfficiency() {
        // ACT
        LineSimulationResult result = sequential.simulate(scenario(DetectionRangeFunction.constant(1.0)), 10, 7L);

        // ASSERT
        assertEquals(RunStatus.COMPLETED, result.status());
        assertEquals(10, result.completedTrials());
        assertEquals(1.0, result.detectionEfficiency());
        for (TrialOutcome outcome : result.outcomes()) {
            assertEquals(outcome.transmissionCount() * 5, outcome.detectionCount());
            assertEquals(0.0, outcome.firstDetectionTime());
            assertNotNull(outcome.lastDetectionTime());
            assertEquals(5, outcome.detectionsPerReceiver().size());
        }
    }

    @Test
    @DisplayName("Detección imposible: eficiencia 0, sin tiempos de detección y todos los receptores a cero")
    void impossibleDetection_zeroEfficiency() {
        LineSimulationResult result = sequential.simulate(scenario(DetectionRangeFunction.constant(0.0)), 10, 7L);

        assertEquals(0.0, result.detectionEfficiency());
        assertEquals(0.0, result.meanDetectionsPerTrial());
        for (TrialOutcome outcome : result.outcomes()) {
            assertFalse(outcome.detected());
            assertNull(outcome.firstDetectionTime());
            assertNull(outcome.lastDetectionTime());
            assertTrue(outcome.transmissionCount() > 0);
        }
        assertEquals(List.of(1, 2, 3, 4, 5), List.copyOf(result.detectionsPerReceiver().keySet()));
        assertTrue(result.detectionsPerReceiver().values().stream().allMatch(c -> c == 0));
    }

    @Test
    @DisplayName("El resultado no depende del número de hilos")
    void sequentialAndParallel_areIdentical() {
        ReceiverLineScenario logistic = scenario(DetectionRangeFunction.logistic(1.5, -0.01));

        LineSimulationResult first = sequential.simulate(logistic, 20, 2024L);
        LineSimulationResult second = parallel.simulate(logistic, 20, 2024L);

        assertEquals(first.outcomes(), second.outcomes());
        for (int i = 0; i < first.outcomes().size(); i++) {
            assertEquals(i, first.outcomes().get(i).trialIndex());
        }
    }

    @Test
    @DisplayName("Cancelación durante la ejecución: resultados parciales con estado CANCELLED")
    void cancellation_returnsPartialResults() {
        // ARRANGE
        CancellationToken token = new CancellationToken();
        SimulationProgressListener cancelAtThree = (completed, total) -> {
            if (completed == 3) {
                token.cancel();
            }
        };

        // ACT
        LineSimulationResult result = sequential.simulate(
                scenario(DetectionRangeFunction.constant(1.0)), 10, 1L, token, cancelAtThree);

        // ASSERT
        assertEquals(RunStatus.CANCELLED, result.status());
        assertEquals(3, result.completedTrials());
        assertEquals(10, result.requestedTrials());
        assertFalse(result.isComplete());
    }

    @Test
    @DisplayName("Cancelación con pool de hilos: parciales en orden de ensayo y estado CANCELLED")
    void cancellation_parallelReturnsOrderedPartialResults() {
        // ARRANGE
        CancellationToken token = new CancellationToken();
        SimulationProgressListener cancelAtThree = (completed, total) -> {
            if (completed == 3) {
                token.cancel();
            }
        };

        // ACT
        LineSimulationResult result = parallel.simulate(
                scenario(DetectionRangeFunction.constant(1.0)), 40, 1L, token, cancelAtThree);

        // ASSERT
        assertEquals(RunStatus.CANCELLED, result.status());
        assertEquals(40, result.requestedTrials());
        assertTrue(result.completedTrials() >= 3, "Los ensayos terminados antes de cancelar se conservan");
        assertTrue(result.completedTrials() < 40);
        List<TrialOutcome> outcomes = result.outcomes();
        for (int i = 1; i < outcomes.size(); i++) {
            assertTrue(outcomes.get(i).trialIndex() > outcomes.get(i - 1).trialIndex(),
                    "Los ensayos deben devolverse en orden creciente de índice");
        }
    }

    @Test
    @DisplayName("Token cancelado de antemano: ningún ensayo y eficiencia indefinida")
    void preCancelled_noOutcomes() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        for (ReceiverLineSimulator simulator : List.of(sequential, parallel)) {
            LineSimulationResult result = simulator.simulate(
                    scenario(DetectionRangeFunction.constant(1.0)), 5, 1L, token, SimulationProgressListener.none());

            assertEquals(RunStatus.CANCELLED, result.status());
            assertEquals(0, result.completedTrials());
            assertTrue(Double.isNaN(result.detectionEfficiency()));
        }
    }

    @Test
    @DisplayName("Barrido de separación: la eficiencia cae al separar los receptores")
    void spacingSweep_efficiencyDropsWithSpacing() {
        // ARRANGE: cruces rectos, escalón de 100 m y una emisión cada 1-2 m
        ReceiverLineConfig line = ReceiverLineConfig.builder()
                .receiverCount(10)
                .spacing(150.0)
                .margin(50.0)
                .crossingDistance(300.0)
                .trialCount(40)
                .build();
        WalkConfig straight = WalkConfig.builder()
                .stepLength(20.0)
                .turnAngleSdDegrees(0.0)
                .build();
        TransmitterConfig dense = TransmitterConfig.builder()
                .velocity(1.0)
                .minDelay(1.0)
                .maxDelay(2.0)
                .burstDuration(0.5)
                .build();

        // ACT
        SweepResult sweep = parallel.sweep(line, straight, dense, DetectionRangeFunction.threshold(100.0),
                SweepParameters.ofSpacings(150.0, 1000.0), 31L, CancellationToken.none(), SimulationProgressListener.none());

        // ASSERT
        assertEquals(RunStatus.COMPLETED, sweep.status());
        assertEquals(2, sweep.entries().size());
        assertEquals(1.0, sweep.entries().get(0).result().detectionEfficiency());
        assertTrue(sweep.entries().get(1).result().detectionEfficiency() < 0.6);

        OptionalDouble spacing = ReceiverLineSimulator.spacingForTargetEfficiency(sweep, 0.95);
        assertTrue(spacing.isPresent());
        assertEquals(150.0, spacing.getAsDouble());
        assertTrue(ReceiverLineSimulator.spacingForTargetEfficiency(sweep, 1.01).isEmpty());
    }

    @Test
    @DisplayName("Barrido de velocidad: un punto por velocidad con la separación base")
    void velocitySweep() {
        SweepParameters parameters = new SweepParameters(List.of(), List.of(0.5, 1.0), List.of());

        SweepResult sweep = sequential.sweep(LINE.withTrialCount(3), WALK, TRANSMITTER,
                DetectionRangeFunction.logistic(1.0, -0.01), parameters, 5L, null, null);

        assertEquals(RunStatus.COMPLETED, sweep.status());
        assertEquals(2, sweep.entries().size());
        assertEquals(0.5, sweep.entries().get(0).point().velocity());
        assertEquals(200.0, sweep.entries().get(1).point().spacing());
        assertEquals(3, sweep.entries().get(1).result().completedTrials());
    }

    @Test
    @DisplayName("Barrido cancelado de antemano: sin puntos y estado CANCELLED")
    void sweep_preCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        SweepResult sweep = sequential.sweep(LINE, WALK, TRANSMITTER, DetectionRangeFunction.constant(1.0),
                SweepParameters.ofSpacings(100.0, 200.0), 1L, token, SimulationProgressListener.none());

        assertEquals(RunStatus.CANCELLED, sweep.status());
        assertTrue(sweep.entries().isEmpty());
    }

    @Test
    @DisplayName("Validación: ensayos, hilos y escenario")
    void validation() {
        ReceiverLineScenario valid = scenario(DetectionRangeFunction.constant(1.0));

        assertThrows(SimulationValidationException.class, () -> sequential.simulate(valid, 0, 1L));
        assertThrows(SimulationValidationException.class, () -> sequential.simulate(null, 5, 1L));
        assertThrows(SimulationValidationException.class,
                () -> sequential.simulate(valid.withReceivers(List.of()), 5, 1L));
        assertThrows(SimulationValidationException.class, () -> new ReceiverLineSimulator(0));
    }
}
