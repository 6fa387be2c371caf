package acoustictelemetry.domain.geometry;

import acoustictelemetry.domain.exception.SimulationValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trayectoria poligonal: secuencia ordenada de {@link PathPoint} cuyo primer elemento es el origen.
 * <p>
 * Precalcula la distancia acumulada de cada vértice para poder interpolar posiciones en
 * O(log n) a partir de una distancia recorrida.
 */
public final class Path {

    private final List<PathPoint> points;
    private final double[] cumulativeDistance;

    private Path(List<PathPoint> points) {
        this.points = Collections.unmodifiableList(points);
        this.cumulativeDistance = new double[points.size()];
        for (int i = 1; i < points.size(); i++) {
            cumulativeDistance[i] = cumulativeDistance[i - 1]
                    + points.get(i - 1).point().distanceTo(points.get(i).point());
        }
    }

    /**
     * Construye una trayectoria a partir de puntos ya ordenados; los índices de paso se asignan
     * secuencialmente desde 0.
     *
     * @throws SimulationValidationException si la lista es nula, vacía o contiene coordenadas no finitas.
     */
    public static Path of(List<Point> points) {
        if (points == null || points.isEmpty()) {
            throw new SimulationValidationException("Una trayectoria necesita al menos un punto (el origen).");
        }
        List<PathPoint> indexed = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            Point p = points.get(i);
            if (p == null || !p.isFinite()) {
                throw new SimulationValidationException("Coordenada no válida en el punto " + i + " de la trayectoria: " + p);
            }
            indexed.add(new PathPoint(i, p));
        }
        return new Path(indexed);
    }

    public static Path of(Point... points) {
        return of(List.of(points));
    }

    public List<PathPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public Point origin() {
        return points.get(0).point();
    }

    public Point end() {
        return points.get(points.size() - 1).point();
    }

    public double totalLength() {
        return cumulativeDistance[cumulativeDistance.length - 1];
    }

    public double cumulativeDistanceAt(int index) {
        return cumulativeDistance[index];
    }

    /**
     * Posición tras recorrer {@code distance} a lo largo de la trayectoria.
     * La distancia se recorta a [0, longitud total].
     */
    public Point interpolate(double distance) {
        if (points.size() == 1 || distance <= 0.0) {
            return origin();
        }
        double total = totalLength();
        if (distance >= total) {
            return end();
        }
        // Primer vértice cuya distancia acumulada supera a la pedida
        int lo = 1;
        int hi = cumulativeDistance.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulativeDistance[mid] < distance) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        double segmentStart = cumulativeDistance[lo - 1];
        double segmentLength = cumulativeDistance[lo] - segmentStart;
        Point a = points.get(lo - 1).point();
        if (segmentLength <= 0.0) {
            return a;
        }
        return a.lerp(points.get(lo).point(), (distance - segmentStart) / segmentLength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Path{points=" + points.size() + ", length=" + totalLength() + "}";
    }
}
