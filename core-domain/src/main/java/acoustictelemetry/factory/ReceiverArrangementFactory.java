package acoustictelemetry.factory;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.BoundingBox;
import acoustictelemetry.domain.geometry.Point;
import acoustictelemetry.domain.telemetry.Receiver;

import java.util.ArrayList;
import java.util.List;

/**
 * Fábrica de disposiciones regulares de receptores.
 * <p>
 * La línea se coloca sobre y = 0 empezando en x = 0; las filas adicionales de una rejilla
 * se apilan hacia +y con la misma separación. Los identificadores se numeran 1..n recorriendo
 * cada fila de izquierda a derecha.
 */
public final class ReceiverArrangementFactory {

    private ReceiverArrangementFactory() {
    }

    public static List<Receiver> line(int receiverCount, double spacing) {
        return grid(1, receiverCount, spacing);
    }

    public static List<Receiver> grid(int rows, int columns, double spacing) {
        if (rows < 1 || columns < 1) {
            throw new SimulationValidationException(
                    String.format("La rejilla necesita al menos una fila y una columna (filas=%d, columnas=%d).", rows, columns));
        }
        if (!(spacing > 0.0) || !Double.isFinite(spacing)) {
            throw new SimulationValidationException("La separación entre receptores debe ser positiva: " + spacing);
        }
        List<Receiver> receivers = new ArrayList<>(rows * columns);
        int id = 1;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                receivers.add(new Receiver(id++, new Point(c * spacing, r * spacing)));
            }
        }
        return receivers;
    }

    public static List<Receiver> fromConfig(ReceiverLineConfig config) {
        int rows = config.getLayout() == ReceiverLineConfig.Layout.GRID ? config.getGridRows() : 1;
        return grid(rows, config.getReceiverCount(), config.getSpacing());
    }

    /**
     * Caja que envuelve las posiciones de los receptores.
     */
    public static BoundingBox extentOf(List<Receiver> receivers) {
        if (receivers == null || receivers.isEmpty()) {
            throw new SimulationValidationException("No hay receptores de los que calcular la extensión.");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Receiver r : receivers) {
            minX = Math.min(minX, r.x());
            minY = Math.min(minY, r.y());
            maxX = Math.max(maxX, r.x());
            maxY = Math.max(maxY, r.y());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }
}
