package acoustictelemetry.domain.telemetry;

import acoustictelemetry.domain.exception.SimulationValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DetectionRangeFunctionTest {

    @ParameterizedTest(name = "d={0} -> p={1}")
    @CsvSource({"0, 1.0", "50, 1.0", "50.0001, 0.0", "1000, 0.0"})
    @DisplayName("Escalón: 1 hasta el rango incluido, 0 después")
    void threshold(double distance, double expected) {
        assertEquals(expected, DetectionRangeFunction.threshold(50).probabilityAt(distance));
    }

    @Test
    @DisplayName("Logística: 0.5 donde b0 + b1*d = 0 y decreciente con pendiente negativa")
    void logistic() {
        DetectionRangeFunction curve = DetectionRangeFunction.logistic(0.5, -1.0 / 120.0);

        assertEquals(0.5, curve.probabilityAt(60.0), 1e-12);
        assertTrue(curve.probabilityAt(100) > curve.probabilityAt(300));
        assertEquals(1.0 / (1.0 + Math.exp(-0.5)), curve.probabilityAt(0.0), 1e-12);
    }

    @Test
    @DisplayName("Tabla: interpolación lineal y extremos constantes")
    void piecewiseLinear() {
        DetectionRangeFunction table = DetectionRangeFunction.piecewiseLinear(
                new double[]{0, 100, 300}, new double[]{0.9, 0.5, 0.0});

        assertEquals(0.9, table.probabilityAt(0), 1e-12);
        assertEquals(0.7, table.probabilityAt(50), 1e-12);
        assertEquals(0.5, table.probabilityAt(100), 1e-12);
        assertEquals(0.25, table.probabilityAt(200), 1e-12);
        assertEquals(0.0, table.probabilityAt(5000), 1e-12);
    }

    @Test
    @DisplayName("Validación de las fábricas")
    void factories_validate() {
        assertThrows(SimulationValidationException.class, () -> DetectionRangeFunction.constant(1.2));
        assertThrows(SimulationValidationException.class, () -> DetectionRangeFunction.threshold(-1));
        assertThrows(SimulationValidationException.class,
                () -> DetectionRangeFunction.piecewiseLinear(new double[]{0, 0}, new double[]{1, 1}));
        assertThrows(SimulationValidationException.class,
                () -> DetectionRangeFunction.piecewiseLinear(new double[]{0, 10}, new double[]{1, 1.5}));
        assertThrows(SimulationValidationException.class,
                () -> DetectionRangeFunction.piecewiseLinear(new double[]{0}, new double[]{1, 1}));
    }
}
