package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.config.ResilienceConfig;
import com.ryuqq.resilience.application.config.ResiliencePresets;
import com.ryuqq.resilience.application.gate.ResilienceMetrics;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.exception.RateLimitExceededException;
import com.ryuqq.resilience.core.exception.ResilienceException;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.priority.OperationPriorities;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.spi.QueueConfig;
import com.ryuqq.resilience.testkit.clock.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

/**
 * 인메모리 보호 장치로 조립한 ResilienceLayer 통합 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ResilienceLayer")
class ResilienceLayerTest {

    private static final long START = 1_767_225_600_000L;

    @Mock
    private ResilienceListener listener;

    private final ManualClock clock = ManualClock.startingAt(START);
    private final List<ResilienceLayer> layers = new ArrayList<>();
    private final ExecutorService callers = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() throws InterruptedException {
        callers.shutdownNow();
        for (ResilienceLayer layer : layers) {
            layer.shutdown(0);
        }
    }

    private ResilienceLayer layer(ResilienceConfig config, Clock clock) {
        ResilienceLayer layer = new ResilienceLayer(config, OperationPriorities.defaults(), listener, clock);
        layers.add(layer);
        return layer;
    }

    private static ResilienceConfig config(RateLimiterConfig rateLimiter, ConcurrencyConfig concurrency,
                                           CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(true, rateLimiter, concurrency, circuitBreaker, new QueueConfig());
    }

    private static Callable<String> failing(AtomicInteger calls) {
        return () -> {
            calls.incrementAndGet();
            throw new IOException("backend unavailable");
        };
    }

    // ============================================================
    // 보호 장치 체인 순서
    // ============================================================

    @Test
    @DisplayName("bucketSize=1 이면 두 번째 즉시 호출은 짧은 timeout 에서 RateLimitExceeded 로 거부된다")
    void secondCallIsRateLimitedWithShortTimeout() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(1, 1),
            new ConcurrencyConfig(1, 10, 200),
            new CircuitBreakerConfig(3, 2, 30_000, 3)), clock);

        // when
        String first = layer.execute(() -> "ok", "memory:remember");

        // then
        assertThat(first).isEqualTo("ok");
        assertThatThrownBy(() -> layer.execute(() -> "never", "memory:remember"))
            .isInstanceOf(RateLimitExceededException.class)
            .satisfies(e -> assertThat(((ResilienceException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("bucketSize=1 이면 두 번째 즉시 호출은 약 1초 리필을 기다린 뒤 실행된다")
    void secondCallWaitsForRefill() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(1, 1),
            new ConcurrencyConfig(1, 10, 5_000),
            new CircuitBreakerConfig(3, 2, 30_000, 3)), Clock.systemUTC());
        layer.execute(() -> "ok", "memory:remember");

        // when
        long start = System.nanoTime();
        String second = layer.execute(() -> "later", "memory:remember");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // then
        assertThat(second).isEqualTo("later");
        assertThat(elapsedMs).isGreaterThanOrEqualTo(800L);
        assertThat(layer.getMetrics().rateLimiter().requestsThrottled()).isEqualTo(1);
    }

    @Test
    @DisplayName("Circuit 이 열려 있으면 토큰을 소비하지 않고 작업도 호출하지 않는다")
    void openCircuitRejectsBeforeRateLimiter() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(10, 1),
            new ConcurrencyConfig(1, 10, 200),
            new CircuitBreakerConfig(1, 1, 30_000, 1)), clock);
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> layer.execute(failing(calls), "memory:remember"))
            .isInstanceOf(IOException.class);
        int tokensAfterTrip = layer.getMetrics().rateLimiter().tokensAvailable();

        // when / then
        assertThatThrownBy(() -> layer.execute(failing(calls), "memory:remember"))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessageStartingWith("Circuit breaker is open");
        assertThat(calls).hasValue(1);
        assertThat(layer.getMetrics().rateLimiter().tokensAvailable()).isEqualTo(tokensAfterTrip);
    }

    // ============================================================
    // Circuit Breaker 연동
    // ============================================================

    @Test
    @DisplayName("failureThreshold 번 실패하면 열리고 이후 호출은 작업을 실행하지 않는다")
    void opensAfterThreshold() {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(4, 10, 1_000),
            new CircuitBreakerConfig(3, 2, 30_000, 1)), clock);
        AtomicInteger calls = new AtomicInteger();

        // when
        for (int i = 0; i < 5; i++) {
            try {
                layer.execute(failing(calls), "memory:remember");
            } catch (Exception e) {
                assertThat(e).isInstanceOfAny(IOException.class, CircuitOpenException.class);
            }
        }

        // then
        assertThat(calls).hasValue(3);
        assertThat(layer.getMetrics().circuitBreaker().state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(layer.isHealthy()).isFalse();
        assertThat(layer.isAcceptingRequests()).isFalse();
        verify(listener).onCircuitOpen(3);
    }

    @Test
    @DisplayName("timeout 이 지나면 다음 호출을 시도하고 successThreshold 번 성공하면 닫힌다")
    void recoversThroughHalfOpen() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(4, 10, 1_000),
            new CircuitBreakerConfig(1, 2, 1_000, 1)), clock);
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> layer.execute(failing(calls), "memory:remember"))
            .isInstanceOf(IOException.class);

        // when
        clock.advanceMillis(1_000);
        String first = layer.execute(() -> "probe-1", "memory:remember");

        // then
        assertThat(first).isEqualTo("probe-1");
        assertThat(layer.getMetrics().circuitBreaker().state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        layer.execute(() -> "probe-2", "memory:remember");
        assertThat(layer.getMetrics().circuitBreaker().state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(layer.isHealthy()).isTrue();
        verify(listener).onCircuitHalfOpen();
        verify(listener).onCircuitClose();
    }

    @Test
    @DisplayName("작업이 던진 checked 예외는 그대로 전달된다")
    void propagatesOperationException() {
        // given
        ResilienceLayer layer = layer(new ResilienceConfig(), clock);
        IOException failure = new IOException("boom");

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> {
            throw failure;
        }, "memory:remember")).isSameAs(failure);
        assertThat(layer.getMetrics().concurrency().active()).isZero();
    }

    // ============================================================
    // CRITICAL 작업 지연
    // ============================================================

    @Test
    @DisplayName("Circuit 이 열려 있어도 CRITICAL 작업은 거부되지 않고 복구 후 실행된다")
    void criticalRunsAfterRecovery() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(4, 10, 5_000),
            new CircuitBreakerConfig(1, 1, 1_000, 1)), clock);
        assertThatThrownBy(() -> layer.execute(failing(new AtomicInteger()), "memory:remember"))
            .isInstanceOf(IOException.class);

        // when: users:delete 는 기본 표에서 CRITICAL
        Future<String> result = callers.submit(() -> layer.execute(() -> "purged", "users:delete"));
        awaitQueued(layer, 1);
        clock.advanceMillis(1_000);

        // then
        assertThat(result.get(3, TimeUnit.SECONDS)).isEqualTo("purged");
        assertThat(layer.getMetrics().circuitBreaker().state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(layer.getMetrics().queue().processed()).isEqualTo(1);
    }

    @Test
    @DisplayName("복구되지 않은 채 timeout 이 지나면 큐에서 취소하고 CircuitOpen 으로 실패한다")
    void criticalTimesOutWhileOpen() {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(4, 10, 200),
            new CircuitBreakerConfig(1, 1, 60_000, 1)), clock);
        assertThatThrownBy(() -> layer.execute(failing(new AtomicInteger()), "memory:remember"))
            .isInstanceOf(IOException.class);
        AtomicInteger calls = new AtomicInteger();

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> calls.incrementAndGet(), "governance:purge", Priority.CRITICAL))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessageContaining("governance:purge");
        assertThat(calls).hasValue(0);
        assertThat(layer.getMetrics().queue().total()).isZero();
    }

    // ============================================================
    // submit 과 우선순위 큐
    // ============================================================

    @Test
    @DisplayName("permit 이 비면 큐에 쌓인 요청을 우선순위 순서로 실행한다")
    void drainsInPriorityOrder() throws Exception {
        // given: maxConcurrent=1 을 blocker 가 점유
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(1, 10, 5_000),
            new CircuitBreakerConfig(5, 2, 30_000, 3)), Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> blocker = layer.submit(() -> {
            release.await(5, TimeUnit.SECONDS);
            return "blocker";
        }, "memory:remember");
        assertThat(layer.getMetrics().concurrency().active()).isEqualTo(1);

        List<String> executed = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Boolean>> queued = new ArrayList<>();
        for (Priority priority : List.of(Priority.LOW, Priority.HIGH, Priority.NORMAL, Priority.CRITICAL)) {
            String name = priority.label();
            queued.add(layer.submit(() -> executed.add(name), "memory:" + name, priority));
        }
        assertThat(layer.getMetrics().queue().total()).isEqualTo(4);

        // when
        release.countDown();

        // then
        assertThat(blocker.get(2, TimeUnit.SECONDS)).isEqualTo("blocker");
        CompletableFuture.allOf(queued.toArray(new CompletableFuture[0])).get(3, TimeUnit.SECONDS);
        assertThat(executed).containsExactly("critical", "high", "normal", "low");
    }

    @Test
    @DisplayName("티어가 가득 차면 QueueFullException 을 던지고 onQueueFull 을 알린다")
    void queueFullRaisesAndNotifies() throws Exception {
        // given
        ResilienceConfig config = new ResilienceConfig(
            true,
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(1, 10, 5_000),
            new CircuitBreakerConfig(),
            new QueueConfig().withMaxSize(Priority.LOW, 1));
        ResilienceLayer layer = layer(config, Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        layer.submit(() -> release.await(5, TimeUnit.SECONDS), "memory:remember");
        CompletableFuture<String> accepted = layer.submit(() -> "a", "memory:export", Priority.LOW);

        // when / then
        assertThatThrownBy(() -> layer.submit(() -> "b", "memory:export", Priority.LOW))
            .isInstanceOf(QueueFullException.class)
            .satisfies(e -> assertThat(((QueueFullException) e).getPriority()).isEqualTo(Priority.LOW));
        verify(listener).onQueueFull(Priority.LOW);
        assertThat(layer.getMetrics().queue().dropped()).isEqualTo(1);

        release.countDown();
        assertThat(accepted.get(2, TimeUnit.SECONDS)).isEqualTo("a");
    }

    @Test
    @DisplayName("Circuit 이 열려 있으면 CRITICAL 이 아닌 submit 은 즉시 거부된다")
    void submitRejectedWhileOpen() {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(1, 10, 1_000),
            new CircuitBreakerConfig(1, 1, 60_000, 1)), clock);
        assertThatThrownBy(() -> layer.execute(failing(new AtomicInteger()), "memory:remember"))
            .isInstanceOf(IOException.class);

        // when / then
        assertThatThrownBy(() -> layer.submit(() -> "x", "memory:remember"))
            .isInstanceOf(CircuitOpenException.class)
            .satisfies(e -> assertThat(((CircuitOpenException) e).getRetryAfterMs()).isEqualTo(60_000L));
        CompletableFuture<String> critical = layer.submit(() -> "x", "users:delete");
        assertThat(critical).isNotDone();
        assertThat(layer.getMetrics().queue().byPriority().get(Priority.CRITICAL)).isEqualTo(1);
    }

    @Test
    @DisplayName("티어가 가득 차서 거부된 submit 은 토큰을 쓰지 않는다")
    void queueFullRejectionKeepsTokens() throws Exception {
        // given: 유일한 permit 을 blocker 가 잡고, LOW 티어(최대 1)를 채운다
        ResilienceConfig config = new ResilienceConfig(
            true,
            new RateLimiterConfig(5, 1),
            new ConcurrencyConfig(1, 10, 5_000),
            new CircuitBreakerConfig(),
            new QueueConfig().withMaxSize(Priority.LOW, 1));
        ResilienceLayer layer = layer(config, clock);
        CountDownLatch release = new CountDownLatch(1);
        layer.submit(() -> release.await(5, TimeUnit.SECONDS), "memory:remember");
        CompletableFuture<String> accepted = layer.submit(() -> "a", "memory:export", Priority.LOW);
        int tokensBefore = layer.getMetrics().rateLimiter().tokensAvailable();

        // when
        assertThatThrownBy(() -> layer.submit(() -> "b", "memory:export", Priority.LOW))
            .isInstanceOf(QueueFullException.class);

        // then
        assertThat(tokensBefore).isEqualTo(3);
        assertThat(layer.getMetrics().rateLimiter().tokensAvailable()).isEqualTo(tokensBefore);
        verify(listener).onQueueFull(Priority.LOW);

        release.countDown();
        assertThat(accepted.get(2, TimeUnit.SECONDS)).isEqualTo("a");
    }

    @Test
    @DisplayName("Circuit 이 열린 동안 쌓인 CRITICAL 요청은 복구 후 토큰을 하나씩 지불하며 실행된다")
    void deferredCriticalBacklogIsRateLimited() throws Exception {
        // given: bucketSize=1, 초당 1개 충전
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(1, 1),
            new ConcurrencyConfig(4, 10, 5_000),
            new CircuitBreakerConfig(1, 1, 1_000, 1)), clock);
        assertThatThrownBy(() -> layer.execute(failing(new AtomicInteger()), "memory:remember"))
            .isInstanceOf(IOException.class);
        AtomicInteger executed = new AtomicInteger();
        List<CompletableFuture<Integer>> deferred = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            deferred.add(layer.submit(executed::incrementAndGet, "users:delete"));
        }
        assertThat(layer.getMetrics().queue().total()).isEqualTo(3);

        // when: Circuit timeout 이 지나는 동안 토큰은 1개만 충전된다
        clock.advanceMillis(1_000);

        // then
        assertThat(deferred.get(0).get(2, TimeUnit.SECONDS)).isEqualTo(1);
        Thread.sleep(300);
        assertThat(executed).hasValue(1);
        assertThat(layer.getMetrics().queue().total()).isEqualTo(2);
        assertThat(layer.getMetrics().rateLimiter().tokensAvailable()).isZero();

        clock.advanceMillis(1_000);
        assertThat(deferred.get(1).get(2, TimeUnit.SECONDS)).isEqualTo(2);
        assertThat(deferred.get(2)).isNotDone();
        assertThat(layer.getMetrics().queue().total()).isEqualTo(1);
    }

    // ============================================================
    // 비활성화
    // ============================================================

    @Test
    @DisplayName("비활성화되면 작업을 그대로 호출하고 합성 예외를 만들지 않는다")
    void passthrough() throws Exception {
        // given
        ResilienceLayer layer = layer(ResiliencePresets.disabled()
            .withRateLimiter(new RateLimiterConfig(1, 0.001))
            .withCircuitBreaker(new CircuitBreakerConfig(1, 1, 60_000, 1)), clock);
        AtomicInteger calls = new AtomicInteger();

        // when
        for (int i = 0; i < 20; i++) {
            assertThatThrownBy(() -> layer.execute(failing(calls), "memory:remember"))
                .isInstanceOf(IOException.class);
        }
        String ok = layer.execute(() -> "ok", "memory:remember");

        // then
        assertThat(calls).hasValue(20);
        assertThat(ok).isEqualTo("ok");
        assertThat(layer.isHealthy()).isTrue();
        assertThat(layer.isAcceptingRequests()).isTrue();
        assertThat(layer.getMetrics().circuitBreaker().failures()).isZero();
    }

    @Test
    @DisplayName("비활성화된 submit 은 호출 스레드에서 완료된 future 를 돌려준다")
    void submitRunsOnCallerThread() throws Exception {
        // given
        ResilienceLayer layer = layer(ResiliencePresets.disabled(), clock);
        String caller = Thread.currentThread().getName();

        // when
        CompletableFuture<String> future = layer.submit(() -> Thread.currentThread().getName(), "memory:remember");
        CompletableFuture<String> failed = layer.submit(() -> {
            throw new IOException("x");
        }, "memory:remember");

        // then
        assertThat(future).isCompletedWithValue(caller);
        assertThat(failed).isCompletedExceptionally();
    }

    // ============================================================
    // 운영 API
    // ============================================================

    @Test
    @DisplayName("getMetrics 는 네 가지 지표와 시계 기준 timestamp 를 모은다")
    void metricsSnapshot() throws Exception {
        // given
        ResilienceLayer layer = layer(new ResilienceConfig(), clock);
        layer.execute(() -> "ok", "memory:remember");

        // when
        ResilienceMetrics metrics = layer.getMetrics();

        // then
        assertThat(metrics.timestamp()).isEqualTo(START);
        assertThat(metrics.rateLimiter().tokensAvailable()).isEqualTo(99);
        assertThat(metrics.concurrency().maxReached()).isEqualTo(1);
        assertThat(metrics.circuitBreaker().state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(metrics.queue().total()).isZero();
    }

    @Test
    @DisplayName("reset 은 Circuit 을 닫고 대기 중인 요청을 실패시킨다")
    void resetClearsEverything() throws Exception {
        // given
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(1, 10, 1_000),
            new CircuitBreakerConfig(1, 1, 60_000, 1)), clock);
        assertThatThrownBy(() -> layer.execute(failing(new AtomicInteger()), "memory:remember"))
            .isInstanceOf(IOException.class);
        CompletableFuture<String> deferred = layer.submit(() -> "x", "users:delete");

        // when
        layer.reset();

        // then
        assertThat(layer.getMetrics().circuitBreaker().state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(layer.getMetrics().rateLimiter().tokensAvailable()).isEqualTo(100);
        assertThatThrownBy(() -> deferred.get(1, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(layer.isHealthy()).isTrue();
        assertThat(layer.execute(() -> "again", "memory:remember")).isEqualTo("again");
    }

    @Test
    @DisplayName("shutdown 은 멱등이며 이후 호출은 IllegalStateException")
    void shutdownIsIdempotent() throws Exception {
        // given
        ResilienceLayer layer = layer(new ResilienceConfig(), clock);

        // when
        layer.shutdown(100);
        layer.shutdown(100);
        layer.stopQueueProcessor();

        // then
        assertThatThrownBy(() -> layer.execute(() -> "x", "memory:remember"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("ResilienceLayer has been shut down");
    }

    @Test
    @DisplayName("shutdown timeout 안에 처리되지 못한 요청은 실패 처리된다")
    void shutdownFailsLeftovers() throws Exception {
        // given: 유일한 permit 을 blocker 가 잡고 있어 큐가 비워지지 않음
        ResilienceLayer layer = layer(config(
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(1, 10, 5_000),
            new CircuitBreakerConfig()), Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        layer.submit(() -> release.await(500, TimeUnit.MILLISECONDS), "memory:remember");
        CompletableFuture<String> leftover = layer.submit(() -> "late", "memory:remember");

        // when
        layer.shutdown(100);

        // then
        assertThat(leftover).isCompletedExceptionally();
        assertThatThrownBy(leftover::join).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("작업 이름이 비어 있으면 IllegalArgumentException")
    void rejectsBlankOperationName() {
        // given
        ResilienceLayer layer = layer(new ResilienceConfig(), clock);

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> "x", " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("operationName cannot be null or blank");
        assertThatThrownBy(() -> layer.submit(null, "memory:remember"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static void awaitQueued(ResilienceLayer layer, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (layer.getMetrics().queue().total() < expected) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("request was not queued within 2000ms");
            }
            Thread.sleep(5);
        }
    }
}
