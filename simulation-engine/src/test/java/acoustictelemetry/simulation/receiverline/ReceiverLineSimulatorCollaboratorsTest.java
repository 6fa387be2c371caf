package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.exception.BoundaryViolationException;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.geometry.Point;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.domain.telemetry.TransmissionEvent;
import acoustictelemetry.domain.telemetry.TransmissionSchedule;
import acoustictelemetry.factory.ReceiverArrangementFactory;
import acoustictelemetry.simulation.path.PathGenerator;
import acoustictelemetry.simulation.transmission.TransmissionScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Orquestación de un ensayo de cruce con generador de trayectorias y planificador simulados.
 */
@ExtendWith(MockitoExtension.class)
class ReceiverLineSimulatorCollaboratorsTest {

    @Mock
    private PathGenerator pathGenerator;

    @Mock
    private TransmissionScheduler scheduler;

    private ReceiverLineScenario scenario;

    @BeforeEach
    void setUp() {
        ReceiverLineConfig line = ReceiverLineConfig.builder().receiverCount(3).spacing(100).crossingDistance(200).build();
        scenario = ReceiverLineScenario.forArrangement(
                ReceiverArrangementFactory.fromConfig(line), line,
                WalkConfig.builder().stepLength(10).stepCount(4).build(),
                TransmitterConfig.getTestingTransmitter(),
                DetectionRangeFunction.threshold(30));
    }

    @Test
    @DisplayName("Cada ensayo encadena trayectoria, calendario y detección con la geometría del escenario")
    void simulate_chainsCollaborators() {
        // ARRANGE: dos emisiones, solo la segunda junto al receptor 2 (x = 100)
        Path path = Path.of(new Point(100, -50), new Point(100, 50));
        TransmissionSchedule schedule = new TransmissionSchedule(List.of(
                new TransmissionEvent(1, new Point(100, -50), 0.0),
                new TransmissionEvent(2, new Point(100, 0), 100.0)), 5.0, 200.0);
        when(pathGenerator.generatePath(any(Point.class), eq(10.0), eq(4), same(scenario.getRegion()), any(),
                eq(Math.PI / 2.0), eq(50), any(Random.class))).thenReturn(path);
        when(scheduler.scheduleTransmissions(same(path), eq(scenario.getTransmitter()), any(Random.class)))
                .thenReturn(schedule);

        // ACT
        LineSimulationResult result;
        try (ReceiverLineSimulator simulator = new ReceiverLineSimulator(1, pathGenerator, scheduler)) {
            result = simulator.simulate(scenario, 4, 11L);
        }

        // ASSERT
        assertEquals(1.0, result.detectionEfficiency());
        for (TrialOutcome outcome : result.outcomes()) {
            assertEquals(2, outcome.transmissionCount());
            assertEquals(1, outcome.detectionCount());
            assertEquals(1, outcome.detectionsPerReceiver().get(2));
            assertEquals(100.0, outcome.firstDetectionTime());
            assertEquals(100.0, outcome.lastDetectionTime());
        }
        verify(pathGenerator, times(4)).generatePath(any(Point.class), anyDouble(), anyInt(), any(), any(),
                any(), anyInt(), any(Random.class));
    }

    @Test
    @DisplayName("Un fallo de frontera en un ensayo se propaga al llamante")
    void simulate_propagatesBoundaryViolation() {
        when(pathGenerator.generatePath(any(Point.class), anyDouble(), anyInt(), any(), any(), any(), anyInt(),
                any(Random.class))).thenThrow(new BoundaryViolationException("sin salida", 3, new Point(0, 0), 50));

        try (ReceiverLineSimulator simulator = new ReceiverLineSimulator(2, pathGenerator, scheduler)) {
            BoundaryViolationException ex = assertThrows(BoundaryViolationException.class,
                    () -> simulator.simulate(scenario, 3, 1L));
            assertEquals(3, ex.getStepIndex());
        }
        verifyNoInteractions(scheduler);
    }
}
