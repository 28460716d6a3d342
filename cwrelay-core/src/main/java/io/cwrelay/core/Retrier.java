package io.cwrelay.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs an action, retrying failures with exponential backoff.
 */
public class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final int maxRetries;
    private final long initialDelayMs;

    public Retrier(int maxRetries, long initialDelayMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
    }

    public static Retrier none() {
        return new Retrier(0, 0);
    }

    /**
     * Invokes {@code action} up to {@code maxRetries + 1} times. The last failure is rethrown.
     *
     * @param description short text used in log messages
     */
    public <T> T call(String description, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                attempt++;
                if (attempt > maxRetries) {
                    throw e;
                }
                long delay = initialDelayMs * (long) Math.pow(2, attempt - 1);
                log.warn("{} failed (attempt {} of {}), retrying in {}ms: {}",
                        description, attempt, maxRetries + 1, delay, e.getMessage());
                sleep(delay, e);
            }
        }
    }

    public void run(String description, Runnable action) {
        call(description, () -> {
            action.run();
            return null;
        });
    }

    private static void sleep(long delay, RuntimeException pending) {
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
