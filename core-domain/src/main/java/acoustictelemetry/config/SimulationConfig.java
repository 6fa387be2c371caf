package acoustictelemetry.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor principal de la configuración de una simulación.
 * Agrupa la semilla y el paralelismo con los parámetros de movimiento, transmisor,
 * detección y disposición de receptores.
 */
@Value
@Builder
@With
@Jacksonized
public class SimulationConfig {

    /**
     * Semilla maestra; las semillas de cada ensayo y receptor se derivan de ella.
     */
    long seed;

    /**
     * Número de hilos de trabajo. 1 = ejecución secuencial.
     */
    @Builder.Default
    int workerCount = 1;

    WalkConfig walk;

    TransmitterConfig transmitter;

    DetectionRangeConfig detectionRange;

    ReceiverLineConfig receiverLine;

    /**
     * Configuración de referencia para pruebas: línea de 10 receptores a 500 m,
     * curva logística típica y transmisor de 60-180 s.
     */
    public static SimulationConfig getTestingConfig() {
        return SimulationConfig.builder()
                .seed(12345L)
                .workerCount(2)
                .walk(WalkConfig.builder()
                        .stepLength(100.0)
                        .stepCount(40)
                        .turnAngleSdDegrees(10.0)
                        .build())
                .transmitter(TransmitterConfig.getTestingTransmitter())
                .detectionRange(DetectionRangeConfig.builder()
                        .type(DetectionRangeConfig.Type.LOGISTIC)
                        .intercept(0.5)
                        .slope(-1.0 / 120.0)
                        .build())
                .receiverLine(ReceiverLineConfig.builder()
                        .spacing(500.0)
                        .receiverCount(10)
                        .crossingDistance(1000.0)
                        .trialCount(50)
                        .build())
                .build();
    }
}
