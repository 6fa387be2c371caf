package acoustictelemetry.utils;

/**
 * Deriva semillas independientes a partir de una semilla maestra (mezcla SplitMix64).
 * <p>
 * Cada receptor, ensayo o hilo recibe {@code derive(master, índice)}, de modo que el
 * resultado no depende del orden ni del número de hilos que ejecuten las tareas.
 */
public final class SeedSequence {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SeedSequence() {
    }

    public static long derive(long masterSeed, long index) {
        return mix(masterSeed + GOLDEN_GAMMA * (index + 1));
    }

    /**
     * Deriva en dos niveles, p. ej. (ensayo, componente).
     */
    public static long derive(long masterSeed, long index, long subIndex) {
        return derive(derive(masterSeed, index), subIndex);
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
