package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.circuit.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.concurrency.FairSemaphore;
import com.ryuqq.resilience.adapter.inmemory.queue.TieredRequestQueue;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.TokenBucket;
import com.ryuqq.resilience.application.config.ResilienceConfig;
import com.ryuqq.resilience.application.gate.ResilienceGate;
import com.ryuqq.resilience.application.gate.ResilienceMetrics;
import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.event.IsolatingListener;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;
import com.ryuqq.resilience.core.priority.OperationPriorities;
import com.ryuqq.resilience.core.priority.PriorityClassifier;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.spi.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resilience Layer 구현체.
 *
 * <p>네 가지 보호 장치를 고정된 순서로 연결하고, 지연된 요청은 {@link QueueDrainer} 로 넘깁니다.</p>
 *
 * <p><strong>execute() 처리 흐름:</strong></p>
 * <pre>
 * 1. circuitBreaker.acquirePermission()
 *      OPEN → CRITICAL 이면 CRITICAL 큐에 넣고 대기, 아니면 CircuitOpenException
 * 2. 우선순위 분류 (또는 명시적 우선순위)
 * 3. rateLimiter.acquire(1, timeoutMs)
 * 4. concurrencyLimiter.acquire(timeoutMs)
 * 5. 작업 실행
 * 6. 결과를 Circuit Breaker 에 보고
 * 7. finally: permit/permission 반환 + drain 신호
 * </pre>
 *
 * <p><strong>submit() 처리 흐름:</strong></p>
 * <pre>
 * Circuit 확인 → 분류 → 티어 여유 확인 → rateLimiter.acquire
 *   ↓
 * 큐가 비어 있고 permission + permit 을 바로 얻으면 worker pool 에서 즉시 실행
 *   ↓ (아니면)
 * 우선순위 큐에 enqueue → drain 루프가 용량이 생길 때 실행
 * </pre>
 *
 * <p>요청마다 토큰은 한 번만 지불합니다. 토큰 없이 큐에 들어간 요청(Circuit 이 열린 동안의
 * CRITICAL 요청)은 {@link QueueDrainer} 가 꺼낼 때 지불합니다.</p>
 *
 * <p>비활성화된 경우 두 경로 모두 작업을 그대로 호출합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceLayer implements ResilienceGate {

    private static final Logger log = LoggerFactory.getLogger(ResilienceLayer.class);

    private static final long SHUTDOWN_POLL_MS = 100;

    private final ResilienceConfig config;
    private final RateLimiter rateLimiter;
    private final ConcurrencyLimiter concurrencyLimiter;
    private final RequestQueue queue;
    private final CircuitBreaker circuitBreaker;
    private final PriorityClassifier classifier;
    private final ResilienceListener listener;
    private final Clock clock;
    private final QueueDrainer drainer;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    /**
     * 기본 우선순위 표와 리스너 없이 생성.
     *
     * @param config 설정
     */
    public ResilienceLayer(ResilienceConfig config) {
        this(config, OperationPriorities.defaults(), ResilienceListener.NONE, Clock.systemUTC());
    }

    /**
     * 인메모리 보호 장치로 생성.
     *
     * @param config 설정
     * @param classifier 작업 이름 → 우선순위 분류기
     * @param listener 상태 변화 리스너
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public ResilienceLayer(ResilienceConfig config, PriorityClassifier classifier,
                           ResilienceListener listener, Clock clock) {
        this(
            requireConfig(config),
            new TokenBucket(config.rateLimiter(), requireClock(clock), requireListener(listener)),
            new FairSemaphore(config.concurrency()),
            new TieredRequestQueue(config.queue(), clock),
            new ConsecutiveFailureCircuitBreaker(config.circuitBreaker(), clock, listener),
            classifier,
            listener,
            clock,
            new QueueDrainerConfig()
        );
    }

    /**
     * 보호 장치를 직접 주입하여 생성.
     *
     * <p>활성화된 설정이면 생성 시점에 drain 루프를 시작합니다.</p>
     *
     * @param config 설정
     * @param rateLimiter Rate Limiter
     * @param concurrencyLimiter 동시성 제한기
     * @param queue 우선순위 큐
     * @param circuitBreaker Circuit Breaker
     * @param classifier 우선순위 분류기
     * @param listener 리스너 ({@code onQueueFull} 은 이 클래스가 호출)
     * @param clock 시간 소스
     * @param drainerConfig drain 루프 설정
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public ResilienceLayer(ResilienceConfig config, RateLimiter rateLimiter, ConcurrencyLimiter concurrencyLimiter,
                           RequestQueue queue, CircuitBreaker circuitBreaker, PriorityClassifier classifier,
                           ResilienceListener listener, Clock clock, QueueDrainerConfig drainerConfig) {
        requireConfig(config);
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (concurrencyLimiter == null) {
            throw new IllegalArgumentException("concurrencyLimiter cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (drainerConfig == null) {
            throw new IllegalArgumentException("drainerConfig cannot be null");
        }

        this.config = config;
        this.rateLimiter = rateLimiter;
        this.concurrencyLimiter = concurrencyLimiter;
        this.queue = queue;
        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
        this.listener = IsolatingListener.wrap(requireListener(listener));
        this.clock = requireClock(clock);
        this.drainer = new QueueDrainer(queue, rateLimiter, concurrencyLimiter, circuitBreaker, drainerConfig,
            QueueDrainer.newWorkerPool(config.concurrency().maxConcurrent()));

        if (config.enabled()) {
            drainer.start();
        } else {
            log.info("Resilience layer disabled, operations run without protection");
        }
    }

    @Override
    public <T> T execute(Callable<T> operation, String operationName) throws Exception {
        return doExecute(operation, operationName, null);
    }

    @Override
    public <T> T execute(Callable<T> operation, String operationName, Priority priority) throws Exception {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return doExecute(operation, operationName, priority);
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> operation, String operationName) {
        return doSubmit(operation, operationName, null);
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> operation, String operationName, Priority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return doSubmit(operation, operationName, priority);
    }

    private <T> T doExecute(Callable<T> operation, String operationName, Priority explicit) throws Exception {
        validate(operation, operationName);
        if (!config.enabled()) {
            return operation.call();
        }

        Priority priority = explicit != null ? explicit : classifier.classify(operationName);

        // 1. Circuit gate
        CallPermission permission;
        try {
            permission = circuitBreaker.acquirePermission();
        } catch (CircuitOpenException e) {
            if (priority == Priority.CRITICAL) {
                return awaitDeferred(operation, operationName, priority);
            }
            throw e;
        }

        // 3, 4. Rate limit, concurrency
        long timeoutMs = config.concurrency().timeoutMs();
        ConcurrencyLimiter.Permit permit = null;
        try {
            rateLimiter.acquire(1, timeoutMs);
            permit = concurrencyLimiter.acquire(timeoutMs);
        } finally {
            if (permit == null) {
                permission.release();
            }
        }

        // 5 - 7
        try {
            T result = operation.call();
            permission.onSuccess();
            return result;
        } catch (Exception e) {
            permission.onFailure(e);
            throw e;
        } finally {
            permission.release();
            permit.release();
            drainer.signal();
        }
    }

    private <T> CompletableFuture<T> doSubmit(Callable<T> operation, String operationName, Priority explicit) {
        validate(operation, operationName);
        if (!config.enabled()) {
            CompletableFuture<T> future = new CompletableFuture<>();
            try {
                future.complete(operation.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
            return future;
        }

        Priority priority = explicit != null ? explicit : classifier.classify(operationName);
        QueuedRequest<T> request = newRequest(operation, operationName, priority);

        if (!circuitBreaker.allowsExecution()) {
            if (priority != Priority.CRITICAL) {
                throw circuitOpen();
            }
            enqueue(request);
            return request.completion();
        }

        if (!queue.hasCapacity(priority)) {
            // 토큰을 쓰지 않고 거부. 그 사이 자리가 났다면 drain 시 토큰을 지불한다
            enqueue(request);
            return request.completion();
        }

        try {
            rateLimiter.acquire(1, config.concurrency().timeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.fail(e);
            return request.completion();
        }
        request.markCharged();

        if (queue.isEmpty()) {
            CallPermission permission = circuitBreaker.tryAcquirePermission();
            if (permission != null) {
                ConcurrencyLimiter.Permit permit = concurrencyLimiter.tryAcquire();
                if (permit != null) {
                    drainer.dispatch(request, permission, permit);
                    return request.completion();
                }
                permission.release();
            }
        }

        enqueue(request);
        return request.completion();
    }

    private <T> T awaitDeferred(Callable<T> operation, String operationName, Priority priority) throws Exception {
        QueuedRequest<T> request = newRequest(operation, operationName, priority);
        long timeoutMs = config.concurrency().timeoutMs();
        enqueue(request);
        log.debug("Circuit open, deferred {} for up to {}ms", request, timeoutMs);

        try {
            return request.completion().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (queue.cancel(request.id())) {
                long retryAfterMs = circuitBreaker.getTimeUntilCloseMs();
                throw new CircuitOpenException(
                    "Circuit breaker is open - critical operation " + operationName
                        + " was not run within " + timeoutMs + "ms", retryAfterMs);
            }
            // 이미 dispatch 되어 실행 중이면 결과를 기다린다
            return awaitOutcome(request);
        } catch (InterruptedException e) {
            queue.cancel(request.id());
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static <T> T awaitOutcome(QueuedRequest<T> request) throws Exception {
        try {
            return request.completion().get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }

    private <T> QueuedRequest<T> newRequest(Callable<T> operation, String operationName, Priority priority) {
        long now = clock.millis();
        return QueuedRequest.of(RequestId.next(now), operation, priority, operationName, now);
    }

    private void enqueue(QueuedRequest<?> request) {
        try {
            queue.enqueue(request);
        } catch (QueueFullException e) {
            listener.onQueueFull(request.priority());
            throw e;
        }
        drainer.signal();
    }

    private CircuitOpenException circuitOpen() {
        long retryAfterMs = circuitBreaker.getTimeUntilCloseMs();
        int failures = circuitBreaker.getMetrics().failures();
        return new CircuitOpenException(
            "Circuit breaker is open (" + failures + " failures). Retry after " + retryAfterMs + "ms",
            retryAfterMs);
    }

    private void validate(Callable<?> operation, String operationName) {
        if (shutdown.get()) {
            throw new IllegalStateException("ResilienceLayer has been shut down");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
    }

    @Override
    public ResilienceMetrics getMetrics() {
        return new ResilienceMetrics(
            rateLimiter.getMetrics(),
            concurrencyLimiter.getMetrics(),
            circuitBreaker.getMetrics(),
            queue.getMetrics(),
            clock.millis()
        );
    }

    @Override
    public void reset() {
        queue.clear();
        queue.resetMetrics();
        rateLimiter.reset();
        concurrencyLimiter.reset();
        circuitBreaker.reset();
        log.info("Resilience layer reset");
    }

    @Override
    public boolean isHealthy() {
        if (!config.enabled()) {
            return true;
        }
        return circuitBreaker.getState() != CircuitBreakerState.OPEN;
    }

    @Override
    public boolean isAcceptingRequests() {
        if (!config.enabled()) {
            return true;
        }
        // queueSize 0 은 대기자가 없을 때만 수용
        int waitLimit = Math.max(1, config.concurrency().queueSize());
        return circuitBreaker.allowsExecution() && concurrencyLimiter.getWaitingCount() < waitLimit;
    }

    @Override
    public void stopQueueProcessor() {
        drainer.stop();
    }

    @Override
    public void shutdown(long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Resilience layer shutting down (timeoutMs={})", timeoutMs);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (drainer.isRunning() && !queue.isEmpty()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                break;
            }
            drainer.signal();
            Thread.sleep(Math.min(SHUTDOWN_POLL_MS, remainingMs));
        }

        int leftovers = queue.size();
        if (leftovers > 0) {
            log.warn("Shutdown timeout: {} requests still in queue", leftovers);
        }
        queue.clear();
        drainer.shutdown();
        log.info("Resilience layer shut down");
    }

    @Override
    public ResilienceConfig getConfig() {
        return config;
    }

    private static ResilienceConfig requireConfig(ResilienceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    private static Clock requireClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return clock;
    }

    private static ResilienceListener requireListener(ResilienceListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        return listener;
    }
}
