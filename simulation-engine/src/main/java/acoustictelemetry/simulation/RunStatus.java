package acoustictelemetry.simulation;

/**
 * Estado final de una ejecución que puede quedar incompleta.
 */
public enum RunStatus {
    /**
     * Se ejecutaron todos los ensayos solicitados.
     */
    COMPLETED,
    /**
     * Se canceló a mitad; los resultados son parciales.
     */
    CANCELLED
}
