package acoustictelemetry.domain.geometry;

import java.util.Locale;
import java.util.Random;

/**
 * Rectángulo alineado con los ejes que envuelve una región.
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    public BoundingBox {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "Caja envolvente inválida: [%f, %f] x [%f, %f]", minX, maxX, minY, maxY));
        }
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    /**
     * Devuelve un punto uniforme dentro de la caja.
     */
    public Point randomPoint(Random random) {
        return new Point(minX + random.nextDouble() * width(), minY + random.nextDouble() * height());
    }
}
