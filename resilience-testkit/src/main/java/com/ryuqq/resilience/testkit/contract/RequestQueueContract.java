package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.metrics.QueueMetrics;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;
import com.ryuqq.resilience.core.spi.QueueConfig;
import com.ryuqq.resilience.core.spi.RequestQueue;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for {@link RequestQueue} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Strict priority across tiers, FIFO within a tier</li>
 *   <li>Per-tier limits with drop accounting</li>
 *   <li>Expiry, cancellation and clearing fail the removed requests</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class RequestQueueContract extends AbstractContractTest {

    /**
     * Creates the queue under test.
     *
     * @param config tier limits
     * @param clock time source used for request ages
     * @return an empty queue
     */
    protected abstract RequestQueue createQueue(QueueConfig config, Clock clock);

    private RequestQueue createQueue() {
        return createQueue(new QueueConfig(), clock);
    }

    private List<String> drain(RequestQueue queue) {
        List<String> names = new ArrayList<>();
        QueuedRequest<?> next;
        while ((next = queue.dequeue()) != null) {
            names.add(next.operationName());
        }
        return names;
    }

    @Test
    void testDequeue_StrictPriorityAcrossTiers() {
        // Given
        RequestQueue queue = createQueue();
        queue.enqueue(newRequest("low", Priority.LOW));
        queue.enqueue(newRequest("normal", Priority.NORMAL));
        queue.enqueue(newRequest("high", Priority.HIGH));
        queue.enqueue(newRequest("critical", Priority.CRITICAL));

        // When
        List<String> order = drain(queue);

        // Then
        assertThat(order).containsExactly("critical", "high", "normal", "low");
        assertThat(queue.getMetrics().processed()).isEqualTo(4);
    }

    @Test
    void testDequeue_FifoWithinTier() {
        // Given
        RequestQueue queue = createQueue();
        queue.enqueue(newRequest("a", Priority.NORMAL));
        queue.enqueue(newRequest("b", Priority.NORMAL));
        queue.enqueue(newRequest("bg", Priority.BACKGROUND));
        queue.enqueue(newRequest("c", Priority.NORMAL));

        // When & Then
        assertThat(drain(queue)).containsExactly("a", "b", "c", "bg");
    }

    @Test
    void testDequeue_Empty_ReturnsNull() {
        // Given
        RequestQueue queue = createQueue();

        // Then
        assertThat(queue.dequeue()).isNull();
        assertThat(queue.peek()).isNull();
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.getMetrics().processed()).isZero();
    }

    @Test
    void testDequeueIf_RejectedHeadStaysInPlace() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> critical = newRequest("critical", Priority.CRITICAL);
        queue.enqueue(newRequest("low", Priority.LOW));
        queue.enqueue(critical);
        List<String> offered = new ArrayList<>();

        // When
        QueuedRequest<?> result = queue.dequeueIf(request -> {
            offered.add(request.operationName());
            return false;
        });

        // Then: the rejected head stays put and lower tiers are not offered
        assertThat(result).isNull();
        assertThat(offered).containsExactly("critical");
        assertThat(queue.peek()).isSameAs(critical);
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.getMetrics().processed()).isZero();
    }

    @Test
    void testDequeueIf_AdmittedHeadIsRemoved() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> high = newRequest("high", Priority.HIGH);
        queue.enqueue(newRequest("normal", Priority.NORMAL));
        queue.enqueue(high);

        // When
        QueuedRequest<?> result = queue.dequeueIf(request -> true);

        // Then
        assertThat(result).isSameAs(high);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.getMetrics().processed()).isEqualTo(1);
        assertThat(queue.dequeueIf(request -> true).operationName()).isEqualTo("normal");
        assertThat(queue.dequeueIf(request -> true)).isNull();
    }

    @Test
    void testPeek_DoesNotRemove() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> request = newRequest("high", Priority.HIGH);
        queue.enqueue(request);

        // Then
        assertThat(queue.peek()).isSameAs(request);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void testEnqueue_FullTier_Rejected() {
        // Given
        RequestQueue queue = createQueue(new QueueConfig(Map.of(Priority.LOW, 2)), clock);
        queue.enqueue(newRequest("l1", Priority.LOW));
        queue.enqueue(newRequest("l2", Priority.LOW));

        // When & Then
        assertThat(queue.hasCapacity(Priority.LOW)).isFalse();
        assertThat(queue.hasCapacity(Priority.NORMAL)).isTrue();
        assertThatThrownBy(() -> queue.enqueue(newRequest("l3", Priority.LOW)))
            .isInstanceOf(QueueFullException.class)
            .satisfies(e -> {
                QueueFullException full = (QueueFullException) e;
                assertThat(full.getPriority()).isEqualTo(Priority.LOW);
                assertThat(full.getQueueSize()).isEqualTo(2);
            });
        assertThat(queue.tryEnqueue(newRequest("l4", Priority.LOW))).isFalse();
        assertThat(queue.tryEnqueue(newRequest("n1", Priority.NORMAL))).isTrue();

        QueueMetrics metrics = queue.getMetrics();
        assertThat(metrics.dropped()).isEqualTo(2);
        assertThat(metrics.total()).isEqualTo(3);
    }

    @Test
    void testSizeByPriority_ContainsAllTiers() {
        // Given
        RequestQueue queue = createQueue();
        queue.enqueue(newRequest("h", Priority.HIGH));
        queue.enqueue(newRequest("b", Priority.BACKGROUND));
        queue.enqueue(newRequest("b2", Priority.BACKGROUND));

        // When
        Map<Priority, Integer> sizes = queue.sizeByPriority();

        // Then
        assertThat(sizes).containsOnlyKeys(Priority.values());
        assertThat(sizes.get(Priority.HIGH)).isEqualTo(1);
        assertThat(sizes.get(Priority.BACKGROUND)).isEqualTo(2);
        assertThat(sizes.get(Priority.CRITICAL)).isZero();
        assertThat(queue.getMetrics().byPriority()).isEqualTo(sizes);
    }

    @Test
    void testOldestRequestAge() {
        // Given
        RequestQueue queue = createQueue();
        assertThat(queue.getOldestRequestAgeMs()).isNull();
        queue.enqueue(newRequest("old", Priority.LOW));
        clock.advanceMillis(200);
        queue.enqueue(newRequest("new", Priority.CRITICAL));

        // When
        clock.advanceMillis(300);

        // Then
        assertThat(queue.getOldestRequestAgeMs()).isEqualTo(500L);
        assertThat(queue.getMetrics().oldestRequestAgeMs()).isEqualTo(500L);
    }

    @Test
    void testRemoveExpired_FailsRemovedRequests() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> first = newRequest("first", Priority.NORMAL);
        QueuedRequest<String> second = newRequest("second", Priority.HIGH);
        queue.enqueue(first);
        queue.enqueue(second);
        clock.advanceMillis(1_000);
        QueuedRequest<String> fresh = newRequest("fresh", Priority.NORMAL);
        queue.enqueue(fresh);
        clock.advanceMillis(500);

        // When
        int removed = queue.removeExpired(1_000);

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.peek()).isSameAs(fresh);
        assertThatThrownBy(() -> first.completion().join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(TimeoutException.class);
        assertThat(second.completion()).isCompletedExceptionally();
        assertThat(fresh.isDone()).isFalse();
    }

    @Test
    void testCancel_FailsWithCancellation() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> request = newRequest("target", Priority.LOW);
        queue.enqueue(request);
        queue.enqueue(newRequest("other", Priority.LOW));

        // When
        boolean cancelled = queue.cancel(request.id());

        // Then
        assertThat(cancelled).isTrue();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(request.completion()).isCancelled();
        assertThatThrownBy(() -> request.completion().join()).isInstanceOf(CancellationException.class);
        assertThat(queue.cancel(RequestId.of("missing"))).isFalse();
    }

    @Test
    void testClear_FailsEveryRequest() {
        // Given
        RequestQueue queue = createQueue();
        QueuedRequest<String> a = newRequest("a", Priority.CRITICAL);
        QueuedRequest<String> b = newRequest("b", Priority.BACKGROUND);
        queue.enqueue(a);
        queue.enqueue(b);

        // When
        queue.clear();

        // Then
        assertThat(queue.isEmpty()).isTrue();
        assertThatThrownBy(() -> b.completion().join())
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Queue cleared");
        assertThat(a.completion()).isCompletedExceptionally();
    }

    @Test
    void testResetMetrics_KeepsQueuedRequests() {
        // Given
        RequestQueue queue = createQueue(new QueueConfig(Map.of(Priority.HIGH, 1)), clock);
        queue.enqueue(newRequest("h1", Priority.HIGH));
        queue.tryEnqueue(newRequest("h2", Priority.HIGH));
        queue.enqueue(newRequest("n1", Priority.NORMAL));
        queue.dequeue();

        // When
        queue.resetMetrics();

        // Then
        QueueMetrics metrics = queue.getMetrics();
        assertThat(metrics.processed()).isZero();
        assertThat(metrics.dropped()).isZero();
        assertThat(metrics.total()).isEqualTo(1);
    }

    @Test
    void testEnqueue_Null_Throws() {
        // Given
        RequestQueue queue = createQueue();

        // Then
        assertThatThrownBy(() -> queue.enqueue(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
