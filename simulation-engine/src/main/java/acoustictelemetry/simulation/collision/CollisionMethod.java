package acoustictelemetry.simulation.collision;

/**
 * Métodos de estimación de la probabilidad de colisión.
 */
public enum CollisionMethod {
    /**
     * Fórmula cerrada bajo independencia entre emisores. Rápida; aproximada con muchas marcas.
     */
    ANALYTIC,
    /**
     * Simulación de secuencias de ráfagas. Más lenta; exacta en el límite de muestras.
     */
    MONTE_CARLO
}
