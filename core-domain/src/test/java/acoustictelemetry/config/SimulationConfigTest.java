package acoustictelemetry.config;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Valores por defecto de los builders")
    void builderDefaults() {
        WalkConfig walk = WalkConfig.builder().stepLength(10).stepCount(5).build();
        ReceiverLineConfig line = ReceiverLineConfig.builder().spacing(200).build();
        SimulationConfig config = SimulationConfig.builder().walk(walk).receiverLine(line).build();

        assertEquals(0.0, walk.getTurnAngleMeanDegrees());
        assertEquals(10.0, walk.getTurnAngleSdDegrees());
        assertEquals(50, walk.getMaxAttemptsPerStep());
        assertNull(walk.getInitialHeadingDegrees());
        assertEquals(ReceiverLineConfig.Layout.LINE, line.getLayout());
        assertEquals(200.0, line.effectiveMargin(), "Sin margen explícito se usa la separación");
        assertEquals(30.0, line.withMargin(30).effectiveMargin());
        assertEquals(1, config.getWorkerCount());
    }

    @Test
    @DisplayName("Curva declarativa: cada tipo produce la función correspondiente")
    void detectionRange_toFunction() {
        DetectionRangeFunction constant = DetectionRangeConfig.builder()
                .type(DetectionRangeConfig.Type.CONSTANT).probability(0.3).build().toFunction();
        DetectionRangeFunction threshold = DetectionRangeConfig.builder()
                .type(DetectionRangeConfig.Type.THRESHOLD).range(100).build().toFunction();
        DetectionRangeFunction table = DetectionRangeConfig.builder()
                .type(DetectionRangeConfig.Type.TABLE)
                .distances(new double[]{0, 200}).probabilities(new double[]{1, 0}).build().toFunction();

        assertEquals(0.3, constant.probabilityAt(1e6));
        assertEquals(1.0, threshold.probabilityAt(100));
        assertEquals(0.0, threshold.probabilityAt(101));
        assertEquals(0.5, table.probabilityAt(100), 1e-12);
        assertThrows(SimulationValidationException.class,
                () -> DetectionRangeConfig.builder().build().toFunction());
    }

    @Test
    @DisplayName("Transmisor: rango de retardo derivado")
    void transmitter_delayRange() {
        TransmitterConfig transmitter = TransmitterConfig.getTestingTransmitter();

        assertEquals(60.0, transmitter.delayRange().min());
        assertEquals(180.0, transmitter.delayRange().max());
        assertEquals(2.0, transmitter.withVelocity(2.0).velocity());
    }

    @Test
    @DisplayName("La configuración de pruebas sobrevive a un ida y vuelta por JSON")
    void jsonRoundTrip() throws Exception {
        // ARRANGE
        SimulationConfig original = SimulationConfig.getTestingConfig();

        // ACT
        String json = mapper.writeValueAsString(original);
        SimulationConfig restored = mapper.readValue(json, SimulationConfig.class);

        // ASSERT
        assertEquals(original, restored);
        assertTrue(json.contains("\"crossingDistance\""));
    }

    @Test
    @DisplayName("Los campos omitidos en JSON toman los valores por defecto")
    void json_missingFieldsUseDefaults() throws Exception {
        String json = "{\"seed\": 7, \"receiverLine\": {\"spacing\": 400}}";

        SimulationConfig config = mapper.readValue(json, SimulationConfig.class);

        assertEquals(7L, config.getSeed());
        assertEquals(1, config.getWorkerCount());
        assertEquals(100, config.getReceiverLine().getTrialCount());
        assertEquals(400.0, config.getReceiverLine().effectiveMargin());
    }
}
