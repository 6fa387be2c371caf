package acoustictelemetry.config;

import acoustictelemetry.domain.telemetry.DelayRange;
import lombok.Builder;
import lombok.With;

/**
 * Parámetros del transmisor (marca acústica) que porta el animal.
 *
 * @param velocity      Velocidad de desplazamiento a lo largo de la trayectoria (unidades/s).
 * @param minDelay      Retardo mínimo entre transmisiones (s).
 * @param maxDelay      Retardo máximo entre transmisiones (s).
 * @param burstDuration Duración de la ráfaga de cada transmisión (s).
 */
@Builder
@With
public record TransmitterConfig(
        double velocity,
        double minDelay,
        double maxDelay,
        double burstDuration
) {

    public DelayRange delayRange() {
        return new DelayRange(minDelay, maxDelay);
    }

    public static TransmitterConfig getTestingTransmitter() {
        return TransmitterConfig.builder()
                .velocity(0.5)
                .minDelay(60.0)
                .maxDelay(180.0)
                .burstDuration(5.0)
                .build();
    }
}
