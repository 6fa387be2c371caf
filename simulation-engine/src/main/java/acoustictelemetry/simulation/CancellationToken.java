package acoustictelemetry.simulation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Señal de cancelación cooperativa. Los simuladores la consultan entre ensayos y devuelven
 * los resultados parciales con estado {@link RunStatus#CANCELLED}.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
