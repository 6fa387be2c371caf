package acoustictelemetry.simulation.transmission;

import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.telemetry.DelayRange;
import acoustictelemetry.domain.telemetry.TransmissionSchedule;

import java.util.Random;

/**
 * Convierte una trayectoria en una secuencia de transmisiones discretas.
 */
public interface TransmissionScheduler {

    TransmissionSchedule scheduleTransmissions(Path path, double velocity, DelayDistribution delays,
                                               double burstDuration, Random random);

    default TransmissionSchedule scheduleTransmissions(Path path, double velocity, DelayRange delayRange,
                                                       double burstDuration, Random random) {
        return scheduleTransmissions(path, velocity, DelayDistribution.uniform(delayRange), burstDuration, random);
    }

    default TransmissionSchedule scheduleTransmissions(Path path, TransmitterConfig transmitter, Random random) {
        return scheduleTransmissions(path, transmitter.velocity(), transmitter.delayRange(),
                transmitter.burstDuration(), random);
    }
}
