package acoustictelemetry.domain.telemetry;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Emisión de una señal por parte del transmisor.
 *
 * @param transmissionId Identificador único y secuencial (empieza en 1).
 * @param position       Posición del transmisor en el momento de emitir.
 * @param elapsedTime    Tiempo transcurrido desde el inicio de la trayectoria, en segundos.
 */
public record TransmissionEvent(int transmissionId, Point position, double elapsedTime) {

    public double x() {
        return position.x();
    }

    public double y() {
        return position.y();
    }

    /**
     * Construye transmisiones a partir del esquema externo de columnas {@code x, y, elapsed_time}.
     * Los identificadores se asignan por orden de entrada (1..n).
     *
     * @throws SimulationValidationException si faltan columnas, difieren sus longitudes o hay valores no finitos.
     */
    public static List<TransmissionEvent> fromColumns(double[] x, double[] y, double[] elapsedTime) {
        if (x == null || y == null || elapsedTime == null) {
            throw new SimulationValidationException("Las transmisiones deben contener las columnas x, y, elapsed_time.");
        }
        if (x.length != y.length || x.length != elapsedTime.length) {
            throw new SimulationValidationException(String.format(
                    "Columnas de transmisiones con longitudes distintas (x=%d, y=%d, elapsed_time=%d).",
                    x.length, y.length, elapsedTime.length));
        }
        List<TransmissionEvent> events = new ArrayList<>(x.length);
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i]) || !Double.isFinite(elapsedTime[i])) {
                throw new SimulationValidationException("Valor no finito en la transmisión " + (i + 1));
            }
            events.add(new TransmissionEvent(i + 1, new Point(x[i], y[i]), elapsedTime[i]));
        }
        return events;
    }
}
