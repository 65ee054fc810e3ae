package com.phillippitts.jobverdict.service.llm;

import com.phillippitts.jobverdict.exception.TransportException;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps the number of in-flight calls to the LLM endpoint with a semaphore.
 *
 * <p>One guard is shared by every client talking to the same endpoint, so the limit reflects the
 * endpoint's own concurrency rather than the number of client beans.
 *
 * <pre>{@code
 * guard.acquire(); // blocks until a permit is available or the timeout expires
 * try {
 *     // ... call the endpoint ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe; the underlying {@link Semaphore} handles concurrent access.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String endpointName;
    private final ApplicationEventPublisher publisher;

    /**
     * @param semaphore semaphore sized to the endpoint's concurrency limit
     * @param timeoutMs maximum time to wait for a permit in milliseconds
     * @param endpointName name used in error messages and events
     * @param publisher event publisher for failure notifications (nullable)
     */
    public ConcurrencyGuard(Semaphore semaphore,
                            long timeoutMs,
                            String endpointName,
                            ApplicationEventPublisher publisher) {
        this.semaphore = semaphore;
        this.timeoutMs = timeoutMs;
        this.endpointName = endpointName;
        this.publisher = publisher;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @throws TransportException if no permit is available in time or the thread is interrupted
     */
    public void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                publishConcurrencyLimitEvent();
                throw new TransportException(
                        endpointName + " concurrency limit reached after " + timeoutMs + "ms wait",
                        endpointName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(
                    endpointName + " call interrupted while waiting for a permit", endpointName, e);
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    private void publishConcurrencyLimitEvent() {
        if (publisher != null) {
            Map<String, String> context = new HashMap<>();
            context.put("reason", "concurrency-limit");
            context.put("timeoutMs", String.valueOf(timeoutMs));

            publisher.publishEvent(new LlmCallFailureEvent(
                    endpointName,
                    Instant.now(),
                    "concurrency limit reached after " + timeoutMs + "ms wait",
                    null,
                    context));
        }
    }
}
