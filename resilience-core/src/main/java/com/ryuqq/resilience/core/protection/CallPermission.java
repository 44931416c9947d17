package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 가 한 번의 호출에 부여한 통과 허가.
 *
 * <p>허가를 받은 호출자는 결과에 따라 정확히 하나의 메서드를 호출해야 합니다.
 * HALF_OPEN 에서 발급된 허가는 이 시점까지 프로브 슬롯을 점유합니다.
 * 두 번째 이후 호출은 무시됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CallPermission {

    /**
     * 작업 성공 기록.
     */
    void onSuccess();

    /**
     * 작업 실패 기록.
     *
     * @param throwable 작업이 던진 예외
     */
    void onFailure(Throwable throwable);

    /**
     * 결과를 기록하지 않고 허가 반환.
     *
     * <p>작업이 실행되기 전에 다른 보호 단계(Rate Limiter 등)에서 거부된 경우 사용합니다.</p>
     */
    void release();
}
