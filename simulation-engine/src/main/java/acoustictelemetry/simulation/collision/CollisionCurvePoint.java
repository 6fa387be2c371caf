package acoustictelemetry.simulation.collision;

/**
 * Punto de la curva de colisión para un número de marcas co-localizadas.
 *
 * @param tagCount             Número de marcas transmitiendo a la vez.
 * @param collisionProbability Probabilidad de que una transmisión colisione con otra.
 * @param detectionProbability Probabilidad de que una transmisión no colisione (1 - colisión).
 */
public record CollisionCurvePoint(int tagCount, double collisionProbability, double detectionProbability) {
}
