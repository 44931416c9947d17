package com.ryuqq.resilience.core.contract;

import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행을 기다리는 지연 요청.
 *
 * <p>작업 자체와 메타데이터, 그리고 결과를 정확히 한 번 전달하는 완료 핸들을 함께 담습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 요청 고유 식별자</li>
 *   <li><strong>operation:</strong> 지연된 작업</li>
 *   <li><strong>priority:</strong> 큐 티어</li>
 *   <li><strong>operationName:</strong> 로깅/지표용 작업 이름</li>
 *   <li><strong>queuedAt:</strong> 큐 진입 시각 (epoch milliseconds)</li>
 *   <li><strong>attempts:</strong> 실행 시도 횟수</li>
 *   <li><strong>charged:</strong> Rate Limiter 토큰을 이미 지불했는지 여부</li>
 * </ul>
 *
 * <p>완료는 멱등합니다: 먼저 도착한 결과(성공/실패/취소)만 반영됩니다.</p>
 *
 * @param <T> 작업 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public final class QueuedRequest<T> {

    private final RequestId id;
    private final Callable<T> operation;
    private final Priority priority;
    private final String operationName;
    private final long queuedAt;
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile boolean charged;
    private final CompletableFuture<T> completion = new CompletableFuture<>();

    private QueuedRequest(RequestId id, Callable<T> operation, Priority priority, String operationName, long queuedAt) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (queuedAt < 0) {
            throw new IllegalArgumentException("queuedAt must be non-negative (current: " + queuedAt + ")");
        }
        this.id = id;
        this.operation = operation;
        this.priority = priority;
        this.operationName = operationName;
        this.queuedAt = queuedAt;
    }

    /**
     * QueuedRequest 생성 (명시적 시각 지정).
     *
     * @param id 요청 ID
     * @param operation 작업
     * @param priority 티어
     * @param operationName 작업 이름
     * @param queuedAt 큐 진입 시각 (epoch milliseconds)
     * @param <T> 결과 타입
     * @return 생성된 요청
     * @throws IllegalArgumentException 필수 필드가 null이거나 queuedAt이 음수인 경우
     */
    public static <T> QueuedRequest<T> of(RequestId id, Callable<T> operation, Priority priority,
                                          String operationName, long queuedAt) {
        return new QueuedRequest<>(id, operation, priority, operationName, queuedAt);
    }

    /**
     * 작업 실행 (시도 횟수 증가).
     *
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외
     */
    public T invoke() throws Exception {
        attempts.incrementAndGet();
        return operation.call();
    }

    /**
     * 성공 결과 전달.
     *
     * @param result 결과
     * @return true: 이번 호출로 완료됨, false: 이미 완료된 요청
     */
    public boolean complete(T result) {
        return completion.complete(result);
    }

    /**
     * 실패 전달.
     *
     * @param error 실패 원인
     * @return true: 이번 호출로 완료됨, false: 이미 완료된 요청
     */
    public boolean fail(Throwable error) {
        return completion.completeExceptionally(error);
    }

    /**
     * 이 요청의 Rate Limiter 토큰이 지불되었음을 기록합니다.
     *
     * <p>큐에 넣기 전에 토큰을 지불한 요청은 drain 시 다시 지불하지 않습니다.</p>
     */
    public void markCharged() {
        charged = true;
    }

    public boolean isCharged() {
        return charged;
    }

    /**
     * 호출자가 기다리는 완료 핸들.
     *
     * @return 결과 future
     */
    public CompletableFuture<T> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public RequestId id() {
        return id;
    }

    public Priority priority() {
        return priority;
    }

    public String operationName() {
        return operationName;
    }

    public long queuedAt() {
        return queuedAt;
    }

    public int attempts() {
        return attempts.get();
    }

    @Override
    public String toString() {
        return "QueuedRequest{" + id.getValue() + ", " + operationName + ", " + priority.label() + '}';
    }
}
