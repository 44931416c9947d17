package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.runtime.Runtime;
import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.spi.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 큐 Drain Runtime 구현체.
 *
 * <p>지연된 요청을 우선순위 큐에서 꺼내 worker pool 에서 실행합니다.
 * 요청마다 스레드를 만들지 않고, 하나의 백그라운드 drain 스레드가 신호(enqueue, permit 반환)
 * 또는 폴링 간격마다 깨어나 {@link #pump()} 를 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * while (큐가 비어 있지 않음):
 *   1. circuitBreaker.tryAcquirePermission() → null 이면 중단
 *   2. concurrencyLimiter.tryAcquire()       → null 이면 permission 반환 후 중단
 *   3. queue.dequeueIf(admit)                → 최고 우선순위 요청
 *        토큰을 아직 지불하지 않은 요청이면 rateLimiter.tryAcquire()
 *        토큰이 없으면 요청은 큐에 남고 permission/permit 반환 후 중단
 *   4. worker pool 에 dispatch:
 *      - 작업 실행
 *      - 결과를 Circuit Breaker 에 보고
 *      - 요청 future 완료
 *      - finally: permit 반환 + drain 신호
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>pump 사이클의 예외는 ERROR 로그 후 errorDelayMs 만큼 대기하고 루프를 계속합니다</li>
 *   <li>worker pool 이 작업을 거부하면 획득한 permission/permit 을 반환하고 요청을 실패 처리합니다</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class QueueDrainer implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueDrainer.class);

    private final RequestQueue queue;
    private final RateLimiter rateLimiter;
    private final ConcurrencyLimiter concurrencyLimiter;
    private final CircuitBreaker circuitBreaker;
    private final QueueDrainerConfig config;
    private final ExecutorService workerExecutor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final ReentrantLock signalLock = new ReentrantLock();
    private final Condition signalled = signalLock.newCondition();
    private boolean pendingSignal;
    private volatile Thread loopThread;

    /**
     * 생성자 (worker 수 = maxConcurrent).
     *
     * @param queue 우선순위 큐
     * @param rateLimiter 토큰을 지불하지 않은 요청에 적용할 Rate Limiter
     * @param concurrencyLimiter 동시성 제한기
     * @param circuitBreaker Circuit Breaker
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public QueueDrainer(RequestQueue queue, RateLimiter rateLimiter, ConcurrencyLimiter concurrencyLimiter,
                        CircuitBreaker circuitBreaker, QueueDrainerConfig config) {
        this(queue, rateLimiter, concurrencyLimiter, circuitBreaker, config,
            newWorkerPool(requireLimiter(concurrencyLimiter).getConfig().maxConcurrent()));
    }

    /**
     * 생성자 (worker pool 주입).
     *
     * @param queue 우선순위 큐
     * @param rateLimiter 토큰을 지불하지 않은 요청에 적용할 Rate Limiter
     * @param concurrencyLimiter 동시성 제한기
     * @param circuitBreaker Circuit Breaker
     * @param config 설정
     * @param workerExecutor dispatch 된 요청을 실행할 pool
     * @throws IllegalArgumentException 의존성이 null 인 경우
     */
    public QueueDrainer(RequestQueue queue, RateLimiter rateLimiter, ConcurrencyLimiter concurrencyLimiter,
                        CircuitBreaker circuitBreaker, QueueDrainerConfig config,
                        ExecutorService workerExecutor) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (concurrencyLimiter == null) {
            throw new IllegalArgumentException("concurrencyLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }

        this.queue = queue;
        this.rateLimiter = rateLimiter;
        this.concurrencyLimiter = concurrencyLimiter;
        this.circuitBreaker = circuitBreaker;
        this.config = config;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public int pump() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("QueueDrainer has been shut down");
        }

        int dispatched = 0;
        while (!queue.isEmpty()) {
            CallPermission permission = circuitBreaker.tryAcquirePermission();
            if (permission == null) {
                break;
            }
            ConcurrencyLimiter.Permit permit = concurrencyLimiter.tryAcquire();
            if (permit == null) {
                permission.release();
                break;
            }
            QueuedRequest<?> request = queue.dequeueIf(this::admit);
            if (request == null) {
                permit.release();
                permission.release();
                break;
            }
            dispatch(request, permission, permit);
            dispatched++;
        }
        return dispatched;
    }

    private boolean admit(QueuedRequest<?> request) {
        // 완료된 요청은 실행되지 않으므로 토큰을 쓰지 않는다
        if (request.isCharged() || request.isDone()) {
            return true;
        }
        if (!rateLimiter.tryAcquire()) {
            return false;
        }
        request.markCharged();
        return true;
    }

    /**
     * 이미 permission 과 permit 을 보유한 요청을 worker pool 에서 실행합니다.
     *
     * <p>두 자원의 소유권은 이 메서드로 넘어오며, 실행이 끝나거나 pool 이 거부하면 반환됩니다.</p>
     *
     * @param request 실행할 요청
     * @param permission Circuit Breaker 호출 허가
     * @param permit 동시성 permit
     */
    public void dispatch(QueuedRequest<?> request, CallPermission permission, ConcurrencyLimiter.Permit permit) {
        try {
            workerExecutor.execute(() -> run(request, permission, permit));
        } catch (RejectedExecutionException e) {
            permission.release();
            permit.release();
            request.fail(e);
            log.warn("Worker pool rejected {}", request, e);
        }
    }

    /**
     * 백그라운드 drain 루프 시작. 이미 실행 중이면 무시합니다.
     *
     * @throws IllegalStateException worker pool 이 이미 종료된 경우
     */
    public void start() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("QueueDrainer has been shut down");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::drainLoop, "resilience-queue-drainer");
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        log.info("Queue drainer started (pollingIntervalMs={})", config.pollingIntervalMs());
    }

    /**
     * drain 루프를 깨웁니다. 루프가 pump 중이면 사이클이 끝난 직후 한 번 더 pump 합니다.
     */
    public void signal() {
        signalLock.lock();
        try {
            pendingSignal = true;
            signalled.signal();
        } finally {
            signalLock.unlock();
        }
    }

    /**
     * drain 루프 중단 (멱등). 실행 중인 worker 작업에는 영향을 주지 않습니다.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = loopThread;
        loopThread = null;
        if (thread != null) {
            thread.interrupt();
            if (thread != Thread.currentThread()) {
                try {
                    thread.join(Math.max(1, config.shutdownAwaitMs()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.info("Queue drainer stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * drain 루프를 멈추고 worker pool 을 종료합니다.
     *
     * <p>진행 중인 작업이 shutdownAwaitMs 안에 끝나지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        stop();
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownAwaitMs(), TimeUnit.MILLISECONDS)) {
            int abandoned = workerExecutor.shutdownNow().size();
            log.warn("Worker pool did not terminate within {}ms ({} tasks abandoned)",
                config.shutdownAwaitMs(), abandoned);
        }
    }

    private void drainLoop() {
        while (running.get()) {
            try {
                pump();
                awaitSignal(config.pollingIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Queue drain cycle failed, retrying in {}ms", config.errorDelayMs(), e);
                try {
                    Thread.sleep(config.errorDelayMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void awaitSignal(long timeoutMs) throws InterruptedException {
        signalLock.lock();
        try {
            if (!pendingSignal) {
                signalled.await(timeoutMs, TimeUnit.MILLISECONDS);
            }
            pendingSignal = false;
        } finally {
            signalLock.unlock();
        }
    }

    private <T> void run(QueuedRequest<T> request, CallPermission permission, ConcurrencyLimiter.Permit permit) {
        try {
            if (request.isDone()) {
                // 호출자가 future 를 취소했거나 이미 실패 처리된 요청
                permission.release();
                return;
            }
            log.debug("Dispatching {} (attempt {})", request, request.attempts() + 1);
            T result = request.invoke();
            permission.onSuccess();
            request.complete(result);
        } catch (Exception e) {
            permission.onFailure(e);
            request.fail(e);
        } catch (Error e) {
            permission.release();
            request.fail(e);
            throw e;
        } finally {
            permit.release();
            signal();
        }
    }

    private static ConcurrencyLimiter requireLimiter(ConcurrencyLimiter concurrencyLimiter) {
        if (concurrencyLimiter == null) {
            throw new IllegalArgumentException("concurrencyLimiter cannot be null");
        }
        return concurrencyLimiter;
    }

    static ExecutorService newWorkerPool(int threads) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "resilience-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
