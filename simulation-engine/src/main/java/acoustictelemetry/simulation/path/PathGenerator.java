package acoustictelemetry.simulation.path;

import acoustictelemetry.config.WalkConfig;
import acoustictelemetry.domain.geometry.BoundaryOracle;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.geometry.Point;

import java.util.Random;

/**
 * Genera trayectorias de movimiento restringidas a una región.
 */
public interface PathGenerator {

    int DEFAULT_MAX_ATTEMPTS_PER_STEP = 50;

    /**
     * @param start           Origen de la trayectoria; debe estar dentro de la región.
     * @param stepLength      Longitud de cada paso (> 0).
     * @param stepCount       Número de pasos (> 0).
     * @param boundary        Región permitida.
     * @param turnAngles      Distribución del giro entre pasos.
     * @param initialHeading  Rumbo inicial en radianes, o {@code null} para sortearlo.
     * @param maxAttempts     Intentos máximos por paso.
     * @param random          Generador aleatorio inyectado.
     */
    Path generatePath(Point start, double stepLength, int stepCount, BoundaryOracle boundary,
                      TurnAngleDistribution turnAngles, Double initialHeading, int maxAttempts, Random random);

    default Path generatePath(Point start, double stepLength, int stepCount, BoundaryOracle boundary,
                              TurnAngleDistribution turnAngles, Random random) {
        return generatePath(start, stepLength, stepCount, boundary, turnAngles, null,
                DEFAULT_MAX_ATTEMPTS_PER_STEP, random);
    }

    /**
     * Genera una trayectoria a partir de una configuración. Si no se indica inicio se sortea un
     * punto uniforme dentro de la región.
     */
    Path generatePath(WalkConfig config, BoundaryOracle boundary, Random random);
}
