package acoustictelemetry.simulation.transmission;

import acoustictelemetry.domain.telemetry.DelayRange;

import java.util.Random;

/**
 * Distribución del retardo entre transmisiones consecutivas. Debe devolver valores positivos.
 */
@FunctionalInterface
public interface DelayDistribution {

    double draw(Random random);

    /**
     * Retardo uniforme sobre el rango; es el comportamiento de los emisores de retardo aleatorio.
     */
    static DelayDistribution uniform(DelayRange range) {
        final double min = range.min();
        final double width = range.width();
        return random -> min + width * random.nextDouble();
    }

    /**
     * Retardo fijo (emisores de intervalo constante).
     */
    static DelayDistribution fixed(double delay) {
        return random -> delay;
    }
}
