package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.geometry.Point;
import acoustictelemetry.domain.telemetry.DetectionRecord;
import acoustictelemetry.domain.telemetry.Receiver;
import acoustictelemetry.domain.telemetry.TransmissionSchedule;
import acoustictelemetry.simulation.CancellationToken;
import acoustictelemetry.simulation.detection.DetectionSimulator;
import acoustictelemetry.simulation.path.PathGenerator;
import acoustictelemetry.simulation.path.TurnAngleDistribution;
import acoustictelemetry.simulation.transmission.TransmissionScheduler;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Un ensayo de cruce: trayectoria → transmisiones → detecciones para un único animal.
 * <p>
 * Devuelve {@code null} si el token ya estaba cancelado cuando la tarea empezó.
 */
@RequiredArgsConstructor
class CrossingTrialTask implements Callable<TrialOutcome> {

    private final ReceiverLineScenario scenario;
    private final int trialIndex;
    private final long seed;
    private final CancellationToken cancellation;
    private final PathGenerator pathGenerator;
    private final TransmissionScheduler scheduler;
    private final DetectionSimulator detectionSimulator;

    @Override
    public TrialOutcome call() {
        if (cancellation.isCancelled()) {
            return null;
        }
        Random random = new Random(seed);
        WalkConfig walk = scenario.getWalk();

        double x = scenario.getStartMinX() + random.nextDouble() * (scenario.getStartMaxX() - scenario.getStartMinX());
        Point start = new Point(x, scenario.getStartY());

        Path path = pathGenerator.generatePath(
                start,
                walk.getStepLength(),
                walk.getStepCount(),
                scenario.getRegion(),
                TurnAngleDistribution.normal(walk.getTurnAngleMeanDegrees(), walk.getTurnAngleSdDegrees()),
                scenario.getHeadingRadians(),
                walk.getMaxAttemptsPerStep(),
                random);

        TransmissionSchedule schedule = scheduler.scheduleTransmissions(path, scenario.getTransmitter(), random);

        List<DetectionRecord> detections = detectionSimulator.simulateDetections(
                schedule.events(), scenario.getReceivers(), scenario.getDetectionRange(), random.nextLong());

        return summarize(schedule, detections);
    }

    private TrialOutcome summarize(TransmissionSchedule schedule, List<DetectionRecord> detections) {
        Map<Integer, Integer> perReceiver = new LinkedHashMap<>();
        for (Receiver receiver : scenario.getReceivers()) {
            perReceiver.put(receiver.receiverId(), 0);
        }
        for (DetectionRecord d : detections) {
            perReceiver.merge(d.receiverId(), 1, Integer::sum);
        }
        // Las detecciones ya vienen ordenadas por tiempo
        Double first = detections.isEmpty() ? null : detections.get(0).elapsedTime();
        Double last = detections.isEmpty() ? null : detections.get(detections.size() - 1).elapsedTime();

        return new TrialOutcome(trialIndex, schedule.size(), detections.size(), perReceiver, first, last);
    }
}
