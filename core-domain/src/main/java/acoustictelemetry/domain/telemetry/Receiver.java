package acoustictelemetry.domain.telemetry;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Receptor fijo de la red. Inmutable y fijo durante toda una ejecución.
 */
public record Receiver(int receiverId, Point position) {

    public double x() {
        return position.x();
    }

    public double y() {
        return position.y();
    }

    /**
     * Construye receptores a partir del esquema externo de columnas {@code x, y} (ids 1..n).
     */
    public static List<Receiver> fromColumns(double[] x, double[] y) {
        if (x == null || y == null) {
            throw new SimulationValidationException("Los receptores deben contener las columnas x, y.");
        }
        if (x.length != y.length) {
            throw new SimulationValidationException(String.format(
                    "Columnas de receptores con longitudes distintas (x=%d, y=%d).", x.length, y.length));
        }
        List<Receiver> receivers = new ArrayList<>(x.length);
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw new SimulationValidationException("Coordenada no finita en el receptor " + (i + 1));
            }
            receivers.add(new Receiver(i + 1, new Point(x[i], y[i])));
        }
        return receivers;
    }
}
