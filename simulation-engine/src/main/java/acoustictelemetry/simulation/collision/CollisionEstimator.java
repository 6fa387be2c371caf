package acoustictelemetry.simulation.collision;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.telemetry.DelayRange;
import acoustictelemetry.utils.SeedSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Estima la probabilidad de colisión entre señales de marcas co-localizadas.
 * <p>
 * Modelo: cada marca repite [ráfaga de {@code burstDuration}][silencio ~ U(min, max)].
 * Una transmisión colisiona si su ventana de ráfaga se solapa con alguna ráfaga de otra
 * marca. La probabilidad devuelta es la de que una transmisión cualquiera colisione con al
 * menos otra.
 */
@Slf4j
@Getter
public class CollisionEstimator {

    public static final int DEFAULT_TRANSMISSIONS_PER_TAG = 2000;
    private static final int MIN_TRANSMISSIONS_PER_TAG = 10;

    /**
     * Máximo de transmisiones simuladas en una estimación Monte Carlo (marcas x transmisiones
     * por marca). Cada una ocupa un double en memoria.
     */
    public static final long MAX_MONTE_CARLO_SAMPLES = 20_000_000L;

    private final CollisionMethod defaultMethod;
    private final int transmissionsPerTag;
    private final long seed;

    public CollisionEstimator() {
        this(CollisionMethod.ANALYTIC, DEFAULT_TRANSMISSIONS_PER_TAG, 0L);
    }

    public CollisionEstimator(CollisionMethod defaultMethod, int transmissionsPerTag, long seed) {
        if (defaultMethod == null) {
            throw new SimulationValidationException("Falta el método de estimación por defecto.");
        }
        if (transmissionsPerTag < MIN_TRANSMISSIONS_PER_TAG) {
            throw new SimulationValidationException(String.format(
                    "Se necesitan al menos %d transmisiones por marca: %d", MIN_TRANSMISSIONS_PER_TAG, transmissionsPerTag));
        }
        this.defaultMethod = defaultMethod;
        this.transmissionsPerTag = transmissionsPerTag;
        this.seed = seed;
    }

    public double estimateCollisionProbability(int numTags, double burstDuration, DelayRange delayRange) {
        return estimate(numTags, burstDuration, delayRange, defaultMethod);
    }

    public double estimate(int numTags, double burstDuration, DelayRange delayRange, CollisionMethod method) {
        validate(numTags, burstDuration, delayRange);
        if (method == null) {
            throw new SimulationValidationException("Falta el método de estimación de colisiones.");
        }
        if (numTags == 1) {
            return 0.0;
        }
        return switch (method) {
            case ANALYTIC -> analytic(numTags, burstDuration, delayRange);
            case MONTE_CARLO -> monteCarlo(numTags, burstDuration, delayRange,
                    new Random(SeedSequence.derive(seed, numTags)));
        };
    }

    /**
     * Curva de colisión para 1..maxTags marcas.
     */
    public List<CollisionCurvePoint> collisionCurve(int maxTags, double burstDuration, DelayRange delayRange,
                                                    CollisionMethod method) {
        if (maxTags < 1) {
            throw new SimulationValidationException("El número máximo de marcas debe ser al menos 1: " + maxTags);
        }
        List<CollisionCurvePoint> curve = new ArrayList<>(maxTags);
        for (int n = 1; n <= maxTags; n++) {
            double collision = estimate(n, burstDuration, delayRange, method);
            curve.add(new CollisionCurvePoint(n, collision, 1.0 - collision));
        }
        log.info("Curva de colisión calculada ({}) hasta {} marcas: {} en el extremo.",
                method, maxTags, curve.get(maxTags - 1).collisionProbability());
        return curve;
    }

    /**
     * Con periodo medio P = ráfaga + retardo medio, la ráfaga de otra marca solapa con una
     * transmisión dada si empieza en una ventana de 2·ráfaga: q = min(1, 2b/P) por marca.
     */
    double analytic(int numTags, double burstDuration, DelayRange delayRange) {
        double period = burstDuration + delayRange.mean();
        double pairwise = Math.min(1.0, 2.0 * burstDuration / period);
        return 1.0 - Math.pow(1.0 - pairwise, numTags - 1);
    }

    double monteCarlo(int numTags, double burstDuration, DelayRange delayRange, Random random) {
        double period = burstDuration + delayRange.mean();
        int total = monteCarloSampleCount(numTags);
        double[] starts = new double[total];

        // Todas las marcas emiten durante al menos [period, commonEnd]; fuera de ahí hay efecto borde
        double commonEnd = Double.POSITIVE_INFINITY;
        int k = 0;
        for (int tag = 0; tag < numTags; tag++) {
            double t = random.nextDouble() * period;
            for (int i = 0; i < transmissionsPerTag; i++) {
                starts[k++] = t;
                t += burstDuration + delayRange.min() + delayRange.width() * random.nextDouble();
            }
            commonEnd = Math.min(commonEnd, starts[k - 1]);
        }
        Arrays.sort(starts);

        long counted = 0;
        long collided = 0;
        for (int i = 0; i < total; i++) {
            double s = starts[i];
            if (s < period || s > commonEnd - period) {
                continue;
            }
            counted++;
            // Todas las ráfagas duran lo mismo: basta con mirar a los vecinos inmediatos
            boolean overlapsPrevious = i > 0 && s - starts[i - 1] < burstDuration;
            boolean overlapsNext = i < total - 1 && starts[i + 1] - s < burstDuration;
            if (overlapsPrevious || overlapsNext) {
                collided++;
            }
        }
        if (counted == 0) {
            throw new IllegalStateException("La ventana de muestreo de colisiones quedó vacía; aumente las transmisiones por marca.");
        }
        log.debug("Monte Carlo de colisión: {} marcas, {} de {} transmisiones colisionan.", numTags, collided, counted);
        return (double) collided / counted;
    }

    private int monteCarloSampleCount(int numTags) {
        long total = Math.multiplyExact((long) numTags, (long) transmissionsPerTag);
        if (total > MAX_MONTE_CARLO_SAMPLES) {
            throw new SimulationValidationException(String.format(
                    "Monte Carlo necesitaría %d transmisiones (%d marcas x %d por marca), más del máximo de %d. "
                            + "Use el método ANALYTIC o menos transmisiones por marca.",
                    total, numTags, transmissionsPerTag, MAX_MONTE_CARLO_SAMPLES));
        }
        return (int) total;
    }

    private static void validate(int numTags, double burstDuration, DelayRange delayRange) {
        if (numTags < 1) {
            throw new SimulationValidationException("El número de marcas debe ser al menos 1: " + numTags);
        }
        if (!(burstDuration > 0.0) || !Double.isFinite(burstDuration)) {
            throw new SimulationValidationException("La duración de ráfaga debe ser positiva: " + burstDuration);
        }
        if (delayRange == null) {
            throw new SimulationValidationException("Falta el rango de retardos.");
        }
    }
}
