package acoustictelemetry.domain.geometry;

import acoustictelemetry.domain.exception.SimulationValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Oráculo de frontera basado en un polígono simple (convexo o no).
 * <p>
 * Contención por ray casting (regla par-impar). Un segmento se considera dentro si ambos
 * extremos y su punto medio lo están y no cruza propiamente ninguna arista. Un polígono de
 * área nula no contiene ningún punto.
 */
public class PolygonBoundary implements BoundaryOracle {

    private static final double AREA_EPSILON = 1e-12;

    private final Point[] vertices;
    private final BoundingBox bounds;
    private final boolean degenerate;

    public PolygonBoundary(List<Point> vertices) {
        if (vertices == null || vertices.isEmpty()) {
            throw new SimulationValidationException("El polígono necesita al menos un vértice.");
        }
        for (Point v : vertices) {
            if (v == null || !v.isFinite()) {
                throw new SimulationValidationException("Vértice de polígono no válido: " + v);
            }
        }
        this.vertices = vertices.toArray(new Point[0]);
        this.bounds = computeBounds(this.vertices);
        this.degenerate = this.vertices.length < 3 || Math.abs(signedArea(this.vertices)) < AREA_EPSILON;
    }

    /**
     * Rectángulo alineado con los ejes.
     */
    public static PolygonBoundary rectangle(double minX, double minY, double maxX, double maxY) {
        return new PolygonBoundary(List.of(
                new Point(minX, minY),
                new Point(maxX, minY),
                new Point(maxX, maxY),
                new Point(minX, maxY)));
    }

    public static PolygonBoundary of(Point... vertices) {
        return new PolygonBoundary(List.of(vertices));
    }

    public double area() {
        return Math.abs(signedArea(vertices));
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    @Override
    public boolean contains(Point point) {
        if (degenerate) {
            return false;
        }
        double px = point.x();
        double py = point.y();
        if (px < bounds.minX() || px > bounds.maxX() || py < bounds.minY() || py > bounds.maxY()) {
            return false;
        }
        boolean inside = false;
        for (int i = 0, j = vertices.length - 1; i < vertices.length; j = i++) {
            Point vi = vertices[i];
            Point vj = vertices[j];
            if ((vi.y() > py) != (vj.y() > py)) {
                double crossX = vj.x() + (py - vj.y()) * (vi.x() - vj.x()) / (vi.y() - vj.y());
                if (px < crossX) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    @Override
    public boolean containsSegment(Point a, Point b) {
        if (!contains(a) || !contains(b) || !contains(a.lerp(b, 0.5))) {
            return false;
        }
        for (int i = 0, j = vertices.length - 1; i < vertices.length; j = i++) {
            if (properlyIntersects(a, b, vertices[j], vertices[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Solo resuelve el caso de visibilidad directa; el camino de menor coste alrededor de
     * obstáculos corresponde a un oráculo ráster externo.
     */
    @Override
    public Optional<Path> pathBetween(Point a, Point b) {
        if (containsSegment(a, b)) {
            return Optional.of(Path.of(a, b));
        }
        return Optional.empty();
    }

    @Override
    public Optional<BoundingBox> bounds() {
        return Optional.of(bounds);
    }

    private static boolean properlyIntersects(Point p1, Point p2, Point q1, Point q2) {
        double d1 = cross(q1, q2, p1);
        double d2 = cross(q1, q2, p2);
        double d3 = cross(p1, p2, q1);
        double d4 = cross(p1, p2, q2);
        return ((d1 > 0 && d2 < 0) || (d1 < 0 && d2 > 0))
                && ((d3 > 0 && d4 < 0) || (d3 < 0 && d4 > 0));
    }

    private static double cross(Point o, Point a, Point b) {
        return (a.x() - o.x()) * (b.y() - o.y()) - (a.y() - o.y()) * (b.x() - o.x());
    }

    private static double signedArea(Point[] vertices) {
        double sum = 0.0;
        for (int i = 0, j = vertices.length - 1; i < vertices.length; j = i++) {
            sum += vertices[j].x() * vertices[i].y() - vertices[i].x() * vertices[j].y();
        }
        return sum / 2.0;
    }

    private static BoundingBox computeBounds(Point[] vertices) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point v : vertices) {
            minX = Math.min(minX, v.x());
            minY = Math.min(minY, v.y());
            maxX = Math.max(maxX, v.x());
            maxY = Math.max(maxY, v.y());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }
}
