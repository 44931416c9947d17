package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.exception.RateLimitExceededException;
import com.ryuqq.resilience.core.metrics.RateLimiterMetrics;

/**
 * Rate Limiter SPI.
 *
 * <p>초당 요청 수를 제한하여 원격 백엔드 과부하를 방지합니다.
 * 버킷 크기만큼의 버스트는 즉시 허용하고, 이후에는 일정 속도로 허용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = new TokenBucket(new RateLimiterConfig(100, 50));
 *
 * if (!limiter.tryAcquire()) {
 *     // 즉시 거부 또는 대기
 *     limiter.acquire(5_000);
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 1개 획득 시도 (비블로킹).
     *
     * @return true: 토큰 획득, false: 토큰 부족
     */
    default boolean tryAcquire() {
        return tryAcquire(1);
    }

    /**
     * 토큰 n개 획득 시도 (비블로킹).
     *
     * <p>확인 전에 경과 시간만큼 토큰을 지연 충전합니다.</p>
     *
     * @param tokens 요청 토큰 수 (1 이상)
     * @return true: 토큰 획득, false: 토큰 부족 (아무것도 소비하지 않음)
     */
    boolean tryAcquire(int tokens);

    /**
     * 토큰 1개 획득 (타임아웃 대기).
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @throws RateLimitExceededException 대기 시간 내에 토큰을 얻지 못한 경우
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    default void acquire(long timeoutMs) throws InterruptedException {
        acquire(1, timeoutMs);
    }

    /**
     * 토큰 n개 획득 (타임아웃 대기).
     *
     * <p>토큰이 충분해질 때까지 호출 스레드를 대기시킵니다.
     * 실패 시 어떤 토큰도 소비하지 않습니다.</p>
     *
     * @param tokens 요청 토큰 수 (1 이상)
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @throws RateLimitExceededException 대기 시간 내에 토큰을 얻지 못한 경우
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void acquire(int tokens, long timeoutMs) throws InterruptedException;

    /**
     * 현재 가용 토큰 수 조회 (내림).
     *
     * @return 가용 토큰 수
     */
    int getAvailableTokens();

    /**
     * 다음 토큰 1개가 충전되기까지 남은 시간.
     *
     * @return 남은 시간 (밀리초), 이미 토큰이 있으면 0
     */
    long getTimeUntilNextTokenMs();

    /**
     * 지표 스냅샷 조회.
     *
     * @return Rate Limiter 지표
     */
    RateLimiterMetrics getMetrics();

    /**
     * 버킷을 가득 채우고 지표를 초기화합니다.
     */
    void reset();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return 설정
     */
    RateLimiterConfig getConfig();
}
