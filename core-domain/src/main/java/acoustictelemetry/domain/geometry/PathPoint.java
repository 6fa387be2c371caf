package acoustictelemetry.domain.geometry;

/**
 * Posición de una trayectoria junto con su índice de paso (0 = origen).
 */
public record PathPoint(int stepIndex, Point point) {

    public double x() {
        return point.x();
    }

    public double y() {
        return point.y();
    }
}
