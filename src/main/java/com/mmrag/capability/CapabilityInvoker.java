package com.mmrag.capability;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.error.NoDataException;
import com.mmrag.error.ValidationException;

/**
 * Runs calls to external capabilities with a per-call timeout. Reads are retried with a
 * linear backoff; writes run once so that a retry can never duplicate stored chunks.
 */
public class CapabilityInvoker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CapabilityInvoker.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExecutorService executor;
    private final Duration timeout;
    private final int maxRetries;
    private final long retryBackoffMs;

    public CapabilityInvoker(Duration timeout, int maxRetries, long retryBackoffMs) {
        this.timeout = timeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "capability-call-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> T read(String capability, Callable<T> call) {
        CapabilityUnavailableException last = null;
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return invoke(capability, call);
            } catch (CapabilityUnavailableException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = retryBackoffMs * attempt;
                log.warn("capability.retry capability={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        capability, attempt, maxAttempts, backoff, e.getMessage());
                sleep(capability, backoff);
            }
        }
        throw last;
    }

    public <T> T write(String capability, Callable<T> call) {
        return invoke(capability, call);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private <T> T invoke(String capability, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CapabilityUnavailableException(capability, "timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CapabilityUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof ValidationException validation) {
                throw validation;
            }
            if (cause instanceof NoDataException noData) {
                throw noData;
            }
            throw new CapabilityUnavailableException(capability, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CapabilityUnavailableException(capability, "interrupted", e);
        }
    }

    private static void sleep(String capability, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityUnavailableException(capability, "interrupted during retry backoff", e);
        }
    }
}
