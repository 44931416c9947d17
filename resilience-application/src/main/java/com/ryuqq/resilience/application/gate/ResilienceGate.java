package com.ryuqq.resilience.application.gate;

import com.ryuqq.resilience.application.config.ResilienceConfig;
import com.ryuqq.resilience.core.model.Priority;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Resilience 진입점 인터페이스.
 *
 * <p>원격 백엔드로 가는 모든 작업을 보호 장치 체인(Circuit Breaker → 우선순위 분류 →
 * Rate Limiter → 동시성 제한)에 통과시킵니다.</p>
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>작업의 결과 또는 작업이 던진 예외 (그대로 전파)</li>
 *   <li>또는 보호 장치가 만든 거부 예외
 *       ({@code RateLimitExceededException}, {@code AcquireTimeoutException},
 *       {@code QueueFullException}, {@code CircuitOpenException})</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Memory memory = gate.execute(() -&gt; client.remember(input), "memory:remember");
 *
 * CompletableFuture&lt;Void&gt; sync = gate.submit(() -&gt; graph.push(batch), "graphSync:push");
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilienceGate {

    /**
     * 작업 동기 실행 (작업 이름으로 우선순위 분류).
     *
     * @param operation 실행할 작업
     * @param operationName 작업 이름 (예: "memory:remember")
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외 또는 거부 예외
     */
    <T> T execute(Callable<T> operation, String operationName) throws Exception;

    /**
     * 작업 동기 실행 (명시적 우선순위).
     *
     * @param operation 실행할 작업
     * @param operationName 작업 이름
     * @param priority 분류 결과 대신 사용할 우선순위
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외 또는 거부 예외
     */
    <T> T execute(Callable<T> operation, String operationName, Priority priority) throws Exception;

    /**
     * 작업 비동기 제출.
     *
     * <p>즉시 실행할 수 있으면 디스패치하고, 아니면 우선순위 큐에 넣습니다.
     * 큐가 가득 찬 경우 {@code QueueFullException} 을 즉시 던집니다.</p>
     *
     * @param operation 실행할 작업
     * @param operationName 작업 이름
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    <T> CompletableFuture<T> submit(Callable<T> operation, String operationName);

    <T> CompletableFuture<T> submit(Callable<T> operation, String operationName, Priority priority);

    ResilienceMetrics getMetrics();

    /**
     * 모든 보호 장치 초기화. 대기 중인 요청은 실패 처리됩니다.
     */
    void reset();

    /**
     * @return 비활성화 상태이거나 Circuit 이 OPEN 이 아니면 true
     */
    boolean isHealthy();

    /**
     * @return 비활성화 상태이거나, Circuit 이 실행을 허용하고 대기열이 가득 차지 않았으면 true
     */
    boolean isAcceptingRequests();

    /**
     * 백그라운드 큐 처리 중단 (멱등).
     */
    void stopQueueProcessor();

    /**
     * 큐가 비워지기를 최대 {@code timeoutMs} 동안 기다린 뒤 종료.
     *
     * <p>남은 요청은 실패 처리됩니다. 여러 번 호출해도 안전합니다.</p>
     *
     * @param timeoutMs 최대 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void shutdown(long timeoutMs) throws InterruptedException;

    ResilienceConfig getConfig();
}
