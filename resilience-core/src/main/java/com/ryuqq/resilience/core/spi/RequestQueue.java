package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.metrics.QueueMetrics;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Priority queue SPI for deferred requests.
 *
 * <p>Holds requests that could not run immediately and hands them to the drain loop
 * in priority order.</p>
 *
 * <p><strong>Ordering guarantees:</strong></p>
 * <ul>
 *   <li>Strict priority across tiers: a request is never dequeued while a higher tier is non-empty</li>
 *   <li>Strict FIFO within a tier</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Bounded: each tier has an independent maximum size ({@link QueueConfig})</li>
 *   <li>Every request that leaves the queue other than through {@link #dequeue()} is failed
 *       through its completion handle, so no caller waits forever</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * queue.enqueue(request);
 *
 * QueuedRequest&lt;?&gt; next = queue.dequeue();
 * if (next != null) {
 *     dispatch(next);
 * }
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RequestQueue {

    /**
     * Appends a request to the tail of its tier.
     *
     * @param request the request to enqueue
     * @throws IllegalArgumentException if request is null
     * @throws QueueFullException if the request's tier is at its maximum size
     */
    void enqueue(QueuedRequest<?> request);

    /**
     * Appends a request to the tail of its tier without throwing when the tier is full.
     *
     * @param request the request to enqueue
     * @return true if accepted, false if the tier is full
     * @throws IllegalArgumentException if request is null
     */
    boolean tryEnqueue(QueuedRequest<?> request);

    /**
     * Removes and returns the head of the highest-priority non-empty tier.
     *
     * @return the next request, or null if the queue is empty
     */
    QueuedRequest<?> dequeue();

    /**
     * Removes and returns the head of the highest-priority non-empty tier, but only if
     * {@code admission} accepts it. The check and the removal are atomic.
     *
     * <p>{@code admission} may have side effects (such as taking a rate token for the request).
     * It must not call back into this queue.</p>
     *
     * @param admission decides whether the head may leave the queue now
     * @return the removed request, or null if the queue is empty or the head was not admitted
     * @throws IllegalArgumentException if admission is null
     */
    QueuedRequest<?> dequeueIf(Predicate<? super QueuedRequest<?>> admission);

    /**
     * Returns the request {@link #dequeue()} would return, without removing it.
     *
     * @return the next request, or null if the queue is empty
     */
    QueuedRequest<?> peek();

    int size();

    /**
     * Returns the current size of every tier.
     *
     * @return map containing all five tiers, in processing order
     */
    Map<Priority, Integer> sizeByPriority();

    boolean isEmpty();

    /**
     * Checks whether a tier can accept another request.
     *
     * @param priority the tier
     * @return true if the tier is below its maximum size
     */
    boolean hasCapacity(Priority priority);

    /**
     * Returns the age of the oldest queued request across all tiers.
     *
     * @return age in milliseconds, or null if the queue is empty
     */
    Long getOldestRequestAgeMs();

    /**
     * Removes requests queued longer than {@code maxAgeMs} and fails them with
     * {@link java.util.concurrent.TimeoutException}.
     *
     * @param maxAgeMs maximum allowed age in milliseconds
     * @return number of removed requests
     */
    int removeExpired(long maxAgeMs);

    /**
     * Removes one request and fails it with {@link java.util.concurrent.CancellationException}.
     *
     * @param requestId id of the request to cancel
     * @return true if the request was queued and has been removed
     */
    boolean cancel(RequestId requestId);

    /**
     * Removes every request and fails each with {@code IllegalStateException("Queue cleared")}.
     */
    void clear();

    QueueMetrics getMetrics();

    /**
     * Zeroes the processed and dropped counters. Queued requests are untouched.
     */
    void resetMetrics();

    QueueConfig getConfig();
}
