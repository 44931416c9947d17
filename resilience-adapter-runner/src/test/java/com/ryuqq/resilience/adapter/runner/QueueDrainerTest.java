package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.circuit.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.concurrency.FairSemaphore;
import com.ryuqq.resilience.adapter.inmemory.queue.TieredRequestQueue;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.TokenBucket;
import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.spi.QueueConfig;
import com.ryuqq.resilience.core.spi.RequestQueue;
import com.ryuqq.resilience.testkit.clock.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * QueueDrainer 유닛 테스트.
 *
 * <p>인메모리 보호 장치와 단일 worker 스레드로 pump 동작을 검증합니다:</p>
 * <ul>
 *   <li>우선순위 순서로 dispatch</li>
 *   <li>Circuit 이 열렸거나 permit 이 없으면 dispatch 중단</li>
 *   <li>토큰을 지불하지 않은 요청은 꺼낼 때 토큰을 지불</li>
 *   <li>작업 실패를 Circuit Breaker 에 보고</li>
 *   <li>백그라운드 루프의 시작/중단과 오류 복구</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class QueueDrainerTest {

    private TieredRequestQueue queue;
    private ManualClock clock;
    private TokenBucket rateLimiter;
    private FairSemaphore semaphore;
    private ConsecutiveFailureCircuitBreaker circuitBreaker;
    private QueueDrainer drainer;

    @BeforeEach
    void setUp() {
        queue = new TieredRequestQueue(new QueueConfig());
        clock = ManualClock.startingAt(0);
        rateLimiter = new TokenBucket(new RateLimiterConfig(100, 50), clock, ResilienceListener.NONE);
        semaphore = new FairSemaphore(new ConcurrencyConfig(1, 10, 1_000));
        circuitBreaker = new ConsecutiveFailureCircuitBreaker(new CircuitBreakerConfig(1, 1, 60_000, 1));
        drainer = new QueueDrainer(queue, rateLimiter, semaphore, circuitBreaker,
            new QueueDrainerConfig(10, 10, 1_000), Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        drainer.shutdown();
    }

    private static <T> QueuedRequest<T> request(String name, Priority priority, Callable<T> operation) {
        long now = System.currentTimeMillis();
        return QueuedRequest.of(RequestId.next(now), operation, priority, name, now);
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (semaphore.getActiveCount() > 0) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("permit was not released within 2000ms");
            }
            Thread.sleep(5);
        }
    }

    // ============================================================
    // 1. 우선순위 순서
    // ============================================================

    @Test
    void pump_는_가장_높은_우선순위부터_하나씩_dispatch_한다() throws Exception {
        // given
        List<String> executed = new CopyOnWriteArrayList<>();
        for (Priority priority : List.of(Priority.LOW, Priority.HIGH, Priority.NORMAL, Priority.CRITICAL)) {
            String name = priority.label();
            queue.enqueue(request(name, priority, () -> executed.add(name)));
        }

        // when: maxConcurrent=1 이므로 pump 한 번에 하나씩
        for (int i = 0; i < 4; i++) {
            assertThat(drainer.pump()).isEqualTo(1);
            awaitIdle();
        }

        // then
        assertThat(executed).containsExactly("critical", "high", "normal", "low");
        assertThat(queue.isEmpty()).isTrue();
        assertThat(drainer.pump()).isZero();
    }

    @Test
    void 성공한_요청의_future_는_결과로_완료된다() throws Exception {
        // given
        QueuedRequest<String> request = request("memory:remember", Priority.HIGH, () -> "stored");
        queue.enqueue(request);

        // when
        drainer.pump();

        // then
        assertThat(request.completion().get(1, TimeUnit.SECONDS)).isEqualTo("stored");
        assertThat(request.attempts()).isEqualTo(1);
        awaitIdle();
        assertThat(semaphore.getActiveCount()).isZero();
    }

    // ============================================================
    // 2. 용량이 없으면 중단
    // ============================================================

    @Test
    void Circuit_이_열려_있으면_아무것도_꺼내지_않는다() {
        // given
        circuitBreaker.forceOpen();
        queue.enqueue(request("memory:remember", Priority.NORMAL, () -> "x"));

        // when
        int dispatched = drainer.pump();

        // then
        assertThat(dispatched).isZero();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(semaphore.getActiveCount()).isZero();
    }

    @Test
    void permit_이_없으면_permission_을_반환하고_중단한다() {
        // given: 유일한 permit 을 점유
        ConcurrencyLimiter.Permit held = semaphore.tryAcquire();
        queue.enqueue(request("memory:remember", Priority.NORMAL, () -> "x"));

        // when
        int dispatched = drainer.pump();

        // then
        assertThat(dispatched).isZero();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);

        held.release();
        assertThat(drainer.pump()).isEqualTo(1);
    }

    // ============================================================
    // 3. Rate Limiter 토큰
    // ============================================================

    @Test
    void 토큰을_지불하지_않은_요청은_꺼낼_때_토큰을_하나_쓴다() throws Exception {
        // given
        QueuedRequest<String> request = request("users:delete", Priority.CRITICAL, () -> "purged");
        queue.enqueue(request);

        // when
        int dispatched = drainer.pump();

        // then
        assertThat(dispatched).isEqualTo(1);
        assertThat(request.isCharged()).isTrue();
        assertThat(request.completion().get(1, TimeUnit.SECONDS)).isEqualTo("purged");
        assertThat(rateLimiter.getAvailableTokens()).isEqualTo(99);
    }

    @Test
    void 이미_지불한_요청은_토큰을_다시_쓰지_않는다() throws Exception {
        // given
        QueuedRequest<String> request = request("memory:remember", Priority.HIGH, () -> "stored");
        request.markCharged();
        queue.enqueue(request);

        // when
        drainer.pump();

        // then
        assertThat(request.completion().get(1, TimeUnit.SECONDS)).isEqualTo("stored");
        assertThat(rateLimiter.getAvailableTokens()).isEqualTo(100);
    }

    @Test
    void 토큰이_없으면_요청을_큐에_남기고_자원을_반환한다() throws Exception {
        // given: 버킷 1개짜리를 비워 둔다
        TokenBucket emptyBucket = new TokenBucket(new RateLimiterConfig(1, 1), clock, ResilienceListener.NONE);
        assertThat(emptyBucket.tryAcquire()).isTrue();
        QueueDrainer throttled = new QueueDrainer(queue, emptyBucket, semaphore, circuitBreaker,
            new QueueDrainerConfig(10, 10, 1_000), Executors.newSingleThreadExecutor());
        QueuedRequest<String> first = request("users:delete", Priority.CRITICAL, () -> "first");
        QueuedRequest<String> second = request("users:purge", Priority.CRITICAL, () -> "second");
        queue.enqueue(first);
        queue.enqueue(second);

        try {
            // when
            int beforeRefill = throttled.pump();

            // then
            assertThat(beforeRefill).isZero();
            assertThat(queue.size()).isEqualTo(2);
            assertThat(semaphore.getActiveCount()).isZero();
            assertThat(first.isCharged()).isFalse();

            // 1초 뒤 토큰 1개만 충전되므로 하나만 나간다
            clock.advanceMillis(1_000);
            assertThat(throttled.pump()).isEqualTo(1);
            assertThat(first.completion().get(1, TimeUnit.SECONDS)).isEqualTo("first");
            assertThat(queue.peek()).isSameAs(second);
            assertThat(second.isCharged()).isFalse();
        } finally {
            throttled.shutdown();
        }
    }

    // ============================================================
    // 4. 실패 보고
    // ============================================================

    @Test
    void 작업_실패는_Circuit_Breaker_에_기록되고_future_로_전달된다() throws Exception {
        // given: failureThreshold=1
        QueuedRequest<String> request = request("memory:remember", Priority.NORMAL, () -> {
            throw new IOException("backend down");
        });
        queue.enqueue(request);

        // when
        drainer.pump();

        // then
        assertThatThrownBy(() -> request.completion().get(1, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IOException.class);
        awaitIdle();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 취소된_요청은_실행하지_않고_permit_만_반환한다() throws Exception {
        // given
        AtomicBoolean invoked = new AtomicBoolean();
        QueuedRequest<String> request = request("memory:remember", Priority.NORMAL, () -> {
            invoked.set(true);
            return "x";
        });
        queue.enqueue(request);
        request.completion().cancel(false);

        // when
        drainer.pump();
        awaitIdle();

        // then
        assertThat(invoked).isFalse();
        assertThat(request.attempts()).isZero();
        assertThat(circuitBreaker.getMetrics().failures()).isZero();
    }

    // ============================================================
    // 5. 라이프사이클
    // ============================================================

    @Test
    void 백그라운드_루프는_신호를_받으면_큐를_비운다() throws Exception {
        // given
        drainer.start();
        drainer.start();
        QueuedRequest<String> request = request("memory:remember", Priority.NORMAL, () -> "done");

        // when
        queue.enqueue(request);
        drainer.signal();

        // then
        assertThat(request.completion().get(2, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(drainer.isRunning()).isTrue();

        drainer.stop();
        drainer.stop();
        assertThat(drainer.isRunning()).isFalse();
    }

    @Test
    void 종료된_뒤에는_pump_와_start_가_거부된다() throws InterruptedException {
        // given
        drainer.shutdown();

        // then
        assertThatThrownBy(() -> drainer.pump())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("QueueDrainer has been shut down");
        assertThatThrownBy(() -> drainer.start())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void worker_pool_이_거부하면_자원을_반환하고_요청을_실패시킨다() throws InterruptedException {
        // given
        drainer.shutdown();
        QueuedRequest<String> request = request("memory:remember", Priority.NORMAL, () -> "x");
        CallPermission permission = circuitBreaker.tryAcquirePermission();
        ConcurrencyLimiter.Permit permit = semaphore.tryAcquire();

        // when
        drainer.dispatch(request, permission, permit);

        // then
        assertThat(request.completion()).isCompletedExceptionally();
        assertThatThrownBy(() -> request.completion().join())
            .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(permit.isReleased()).isTrue();
        assertThat(semaphore.getActiveCount()).isZero();
    }

    @Test
    void pump_사이클_예외가_나도_루프는_계속된다() throws InterruptedException {
        // given
        RequestQueue failingQueue = mock(RequestQueue.class);
        given(failingQueue.isEmpty())
            .willThrow(new IllegalStateException("boom"))
            .willReturn(true);
        QueueDrainer loop = new QueueDrainer(failingQueue, rateLimiter, semaphore, circuitBreaker,
            new QueueDrainerConfig(10, 10, 1_000), Executors.newSingleThreadExecutor());

        // when
        loop.start();

        // then
        verify(failingQueue, timeout(2_000).atLeast(3)).isEmpty();
        assertThat(loop.isRunning()).isTrue();
        loop.shutdown();
    }

    @Test
    void 의존성이_null_이면_예외() {
        assertThatThrownBy(() -> new QueueDrainer(null, rateLimiter, semaphore, circuitBreaker, new QueueDrainerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("queue cannot be null");
        assertThatThrownBy(() -> new QueueDrainer(queue, null, semaphore, circuitBreaker, new QueueDrainerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("rateLimiter cannot be null");
        assertThatThrownBy(() -> new QueueDrainer(queue, rateLimiter, null, circuitBreaker, new QueueDrainerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("concurrencyLimiter cannot be null");
        assertThatThrownBy(() -> new QueueDrainer(queue, rateLimiter, semaphore, null, new QueueDrainerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("circuitBreaker cannot be null");
    }
}
