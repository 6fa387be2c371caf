package acoustictelemetry.domain.geometry;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Coordenada plana inmutable (x, y).
 * <p>
 * El motor es agnóstico a las unidades: puede tratarse de metros proyectados o de
 * longitud/latitud, siempre que todas las entradas usen el mismo sistema.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0.0, 0.0);

    /**
     * Distancia euclídea a otro punto.
     */
    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    /**
     * Avanza una distancia a lo largo de un rumbo.
     *
     * @param heading Rumbo en radianes, medido desde el eje +x en sentido antihorario.
     * @param length  Distancia a recorrer.
     * @return El punto de destino.
     */
    public Point advance(double heading, double length) {
        return new Point(x + length * Math.cos(heading), y + length * Math.sin(heading));
    }

    /**
     * Interpolación lineal entre este punto y {@code other}.
     *
     * @param fraction 0 devuelve este punto, 1 devuelve {@code other}.
     */
    public Point lerp(Point other, double fraction) {
        return new Point(x + (other.x - x) * fraction, y + (other.y - y) * fraction);
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
