package acoustictelemetry.simulation.detection;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.domain.telemetry.DetectionRecord;
import acoustictelemetry.domain.telemetry.Receiver;
import acoustictelemetry.domain.telemetry.TransmissionEvent;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Tarea que simula la detección de todas las transmisiones en un único receptor.
 * <p>
 * Calcula la distancia a cada transmisión, la traduce a probabilidad con la curva de rango y
 * realiza un ensayo de Bernoulli independiente por par. Las detecciones se devuelven en el
 * orden de entrada de las transmisiones. Diseñada para ejecutarse en un pool de hilos: su
 * generador aleatorio es propio y se siembra con una semilla derivada del índice del receptor.
 */
@Getter
@RequiredArgsConstructor
public class ReceiverDetectionTask implements Callable<List<DetectionRecord>> {

    private final Receiver receiver;
    private final List<TransmissionEvent> transmissions;
    private final DetectionRangeFunction detectionRange;
    private final long seed;

    @Override
    public List<DetectionRecord> call() {
        int n = transmissions.size();
        double rx = receiver.x();
        double ry = receiver.y();

        // Primero todas las probabilidades: una curva inválida aborta antes de sortear nada
        double[] probabilities = new double[n];
        for (int i = 0; i < n; i++) {
            TransmissionEvent t = transmissions.get(i);
            double distance = Math.hypot(t.x() - rx, t.y() - ry);
            double p = detectionRange.probabilityAt(distance);
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new SimulationValidationException(String.format(Locale.ROOT,
                        "La función de rango devolvió %s para la distancia %.4f (receptor %d); debe estar en [0, 1].",
                        p, distance, receiver.receiverId()));
            }
            probabilities[i] = p;
        }

        Random random = new Random(seed);
        List<DetectionRecord> detections = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < probabilities[i]) {
                detections.add(DetectionRecord.of(transmissions.get(i), receiver));
            }
        }
        return detections;
    }
}
