package acoustictelemetry.domain.geometry;

import java.util.Optional;

/**
 * Oráculo de la región navegable (masa de agua) dentro de la cual se mueve el animal.
 * <p>
 * El núcleo de simulación solo consume esta capacidad; no le importa si detrás hay un
 * polígono, un ráster de coste o cualquier otra representación. Solo {@link #contains(Point)}
 * es obligatorio, así que una lambda es un oráculo válido.
 */
@FunctionalInterface
public interface BoundaryOracle {

    /**
     * @return {@code true} si el punto está dentro de la región permitida.
     */
    boolean contains(Point point);

    /**
     * Comprueba si el segmento {@code a -> b} queda dentro de la región.
     * <p>
     * La implementación por defecto solo comprueba los extremos. Las implementaciones que
     * conozcan la frontera deberían detectar también los cruces (p. ej. una península estrecha).
     */
    default boolean containsSegment(Point a, Point b) {
        return contains(a) && contains(b);
    }

    /**
     * Camino de menor coste (el más corto por agua) entre dos puntos.
     *
     * @return Vacío si la implementación no soporta la consulta o no existe camino.
     */
    default Optional<Path> pathBetween(Point a, Point b) {
        return Optional.empty();
    }

    /**
     * Caja envolvente de la región. Solo se necesita para sortear posiciones iniciales.
     */
    default Optional<BoundingBox> bounds() {
        return Optional.empty();
    }
}
