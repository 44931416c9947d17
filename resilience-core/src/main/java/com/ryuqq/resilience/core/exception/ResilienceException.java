package com.ryuqq.resilience.core.exception;

/**
 * 보호 계층이 발생시키는 합성(synthetic) 거부 예외의 공통 상위 타입.
 *
 * <p>이 타입의 예외는 모두 "나중에 다시 시도" 신호입니다.
 * 감싼 작업 자체가 던진 애플리케이션 예외와 구분하기 위해 사용합니다.</p>
 *
 * <pre>{@code
 * try {
 *     return layer.execute(() -> client.call(), "memory:remember");
 * } catch (ResilienceException e) {
 *     // 과부하/차단: backoff 후 재시도
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    /**
     * 재시도 가능 여부.
     *
     * <p>모든 합성 거부는 작업이 실행되지 않았거나(혹은 대기 중 거부되었거나)
     * 자원을 보유하지 않은 상태이므로 항상 재시도 가능합니다.</p>
     *
     * @return 항상 true
     */
    public boolean isRetryable() {
        return true;
    }
}
