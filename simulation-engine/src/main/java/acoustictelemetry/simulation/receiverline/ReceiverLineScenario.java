package acoustictelemetry.simulation.receiverline;

import acoustictelemetry.config.ReceiverLineConfig;
import acoustictelemetry.config.SimulationConfig;
import acoustictelemetry.config.TransmitterConfig;
import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.BoundaryOracle;
import acoustictelemetry.domain.geometry.BoundingBox;
import acoustictelemetry.domain.geometry.PolygonBoundary;
import acoustictelemetry.domain.telemetry.DetectionRangeFunction;
import acoustictelemetry.domain.telemetry.Receiver;
import acoustictelemetry.factory.ReceiverArrangementFactory;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Escenario reutilizable de cruce de una línea de receptores.
 * <p>
 * La región se construye una sola vez y se comparte entre todos los ensayos (y entre todos los
 * puntos de un barrido que no cambien la disposición). Cada animal parte de un punto aleatorio
 * de la recta {@code y = startY}, entre {@code startMinX} y {@code startMaxX}, con rumbo
 * {@code headingRadians} hacia la línea.
 */
@Value
@Builder
@With
public class ReceiverLineScenario {

    BoundaryOracle region;
    List<Receiver> receivers;

    double startY;
    double startMinX;
    double startMaxX;

    /**
     * Rumbo inicial; por defecto hacia +y (perpendicular a la línea).
     */
    @Builder.Default
    double headingRadians = Math.PI / 2.0;

    WalkConfig walk;
    TransmitterConfig transmitter;
    DetectionRangeFunction detectionRange;

    /**
     * Construye el escenario estándar: rectángulo que envuelve la disposición con
     * {@code margin} a los lados y {@code crossingDistance} por delante y por detrás.
     * Si la configuración del paseo no fija el número de pasos, se usan los que caben al
     * atravesar la región en línea recta.
     */
    public static ReceiverLineScenario forArrangement(List<Receiver> receivers, ReceiverLineConfig line,
                                                      WalkConfig walk, TransmitterConfig transmitter,
                                                      DetectionRangeFunction detectionRange) {
        if (line == null || walk == null || transmitter == null || detectionRange == null) {
            throw new SimulationValidationException("El escenario de cruce necesita línea, paseo, transmisor y curva de rango.");
        }
        if (!(line.getCrossingDistance() > 0.0)) {
            throw new SimulationValidationException("La distancia de cruce debe ser positiva: " + line.getCrossingDistance());
        }
        if (!(walk.getStepLength() > 0.0)) {
            throw new SimulationValidationException("La longitud de paso debe ser positiva: " + walk.getStepLength());
        }
        BoundingBox extent = ReceiverArrangementFactory.extentOf(receivers);
        double margin = line.effectiveMargin();
        double crossing = line.getCrossingDistance();

        double minX = extent.minX() - margin;
        double maxX = extent.maxX() + margin;
        double minY = extent.minY() - crossing;
        double maxY = extent.maxY() + crossing;
        if (!(maxX > minX)) {
            throw new SimulationValidationException("La región de cruce no tiene anchura; use un margen positivo.");
        }
        PolygonBoundary region = PolygonBoundary.rectangle(minX, minY, maxX, maxY);

        // Se parte ligeramente dentro del borde para no depender del tratamiento de la frontera
        double inset = crossing * 1e-3;
        double insetX = Math.min(inset, (maxX - minX) / 4.0);
        double startY = minY + inset;
        WalkConfig effectiveWalk = walk.getStepCount() > 0
                ? walk
                : walk.withStepCount(Math.max(1, (int) Math.floor((maxY - startY) / walk.getStepLength())));

        return ReceiverLineScenario.builder()
                .region(region)
                .receivers(List.copyOf(receivers))
                .startY(startY)
                .startMinX(minX + insetX)
                .startMaxX(maxX - insetX)
                .walk(effectiveWalk)
                .transmitter(transmitter)
                .detectionRange(detectionRange)
                .build();
    }

    /**
     * Escenario a partir de la configuración completa de la simulación.
     */
    public static ReceiverLineScenario fromConfig(SimulationConfig config) {
        if (config.getReceiverLine() == null || config.getDetectionRange() == null) {
            throw new SimulationValidationException("La configuración no define la línea de receptores o la curva de rango.");
        }
        return forArrangement(
                ReceiverArrangementFactory.fromConfig(config.getReceiverLine()),
                config.getReceiverLine(),
                config.getWalk(),
                config.getTransmitter(),
                config.getDetectionRange().toFunction());
    }
}
