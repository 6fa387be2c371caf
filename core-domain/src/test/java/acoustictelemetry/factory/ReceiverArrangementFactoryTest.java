package acoustictelemetry.factory;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.BoundingBox;
import acoustictelemetry.domain.geometry.Point;
import acoustictelemetry.domain.telemetry.Receiver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReceiverArrangementFactoryTest {

    @Test
    @DisplayName("Línea: receptores equiespaciados sobre y = 0 con ids 1..n")
    void line_equallySpaced() {
        // ACT
        List<Receiver> receivers = ReceiverArrangementFactory.line(4, 250.0);

        // ASSERT
        assertEquals(4, receivers.size());
        for (int i = 0; i < receivers.size(); i++) {
            assertEquals(i + 1, receivers.get(i).receiverId());
            assertEquals(new Point(i * 250.0, 0.0), receivers.get(i).position());
        }
    }

    @Test
    @DisplayName("Rejilla: filas apiladas hacia +y, numeración por filas")
    void grid_rowMajorIds() {
        List<Receiver> receivers = ReceiverArrangementFactory.grid(2, 3, 100.0);

        assertEquals(6, receivers.size());
        assertEquals(new Receiver(4, new Point(0, 100)), receivers.get(3));
        assertEquals(new Receiver(6, new Point(200, 100)), receivers.get(5));
    }

    @Test
    @DisplayName("Desde configuración: LINE ignora gridRows, GRID lo respeta")
    void fromConfig_respectsLayout() {
        ReceiverLineConfig line = ReceiverLineConfig.builder().receiverCount(5).gridRows(3).spacing(50).build();
        ReceiverLineConfig grid = line.withLayout(ReceiverLineConfig.Layout.GRID);

        assertEquals(5, ReceiverArrangementFactory.fromConfig(line).size());
        assertEquals(15, ReceiverArrangementFactory.fromConfig(grid).size());
    }

    @Test
    @DisplayName("Extensión de la disposición")
    void extentOf() {
        BoundingBox box = ReceiverArrangementFactory.extentOf(ReceiverArrangementFactory.grid(2, 3, 100.0));

        assertEquals(new BoundingBox(0, 0, 200, 100), box);
    }

    @Test
    @DisplayName("Validación: número de receptores y separación")
    void validation() {
        assertThrows(SimulationValidationException.class, () -> ReceiverArrangementFactory.line(0, 100));
        assertThrows(SimulationValidationException.class, () -> ReceiverArrangementFactory.line(3, 0));
        assertThrows(SimulationValidationException.class, () -> ReceiverArrangementFactory.grid(1, 3, Double.NaN));
        assertThrows(SimulationValidationException.class, () -> ReceiverArrangementFactory.extentOf(List.of()));
    }
}
