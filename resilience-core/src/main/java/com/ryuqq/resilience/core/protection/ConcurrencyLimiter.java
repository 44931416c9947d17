package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.exception.AcquireTimeoutException;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.metrics.ConcurrencyMetrics;

/**
 * 동시성 제한기 SPI (Bulkhead).
 *
 * <p>동시 실행 수를 제한하여 특정 작업이 원격 백엔드의 동시 처리 한도를 넘지 않도록 격리합니다.
 * 대기자는 도착 순서(FIFO)대로 permit 을 받습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ConcurrencyLimiter limiter = ...;
 *
 * ConcurrencyLimiter.Permit permit = limiter.acquire(5_000);
 * try {
 *     return externalApi.call();
 * } finally {
 *     permit.release();
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ConcurrencyLimiter {

    /**
     * permit 획득 시도 (비블로킹).
     *
     * <p>대기자가 있으면 새치기하지 않고 null 을 반환합니다.</p>
     *
     * @return permit, 여유가 없으면 null
     */
    Permit tryAcquire();

    /**
     * 설정된 기본 타임아웃으로 permit 획득.
     *
     * @return permit
     * @throws QueueFullException 대기 목록이 이미 가득 찬 경우 (대기열에 넣지 않음)
     * @throws AcquireTimeoutException 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    Permit acquire() throws InterruptedException;

    /**
     * permit 획득 (타임아웃 대기).
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return permit
     * @throws QueueFullException 대기 목록이 이미 가득 찬 경우 (대기열에 넣지 않음)
     * @throws AcquireTimeoutException 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    Permit acquire(long timeoutMs) throws InterruptedException;

    /**
     * 현재 permit 보유 수 조회.
     *
     * @return 실행 중인 작업 수
     */
    int getActiveCount();

    /**
     * permit 대기자 수 조회.
     *
     * @return 대기 중인 요청 수
     */
    int getWaitingCount();

    /**
     * 즉시 발급 가능한 permit 수 조회.
     *
     * @return 가용 permit 수
     */
    int getAvailableCount();

    /**
     * 지표 스냅샷 조회.
     *
     * @return 동시성 지표
     */
    ConcurrencyMetrics getMetrics();

    /**
     * 초기 상태로 리셋.
     *
     * <p>모든 대기자를 실패시키고 permit 을 모두 회수합니다.
     * 리셋 이전에 발급된 permit 의 release() 는 아무 효과가 없습니다.</p>
     */
    void reset();

    /**
     * 설정 정보 조회.
     *
     * @return 설정
     */
    ConcurrencyConfig getConfig();

    /**
     * 발급된 동시 실행 슬롯.
     *
     * <p>일회용입니다. 두 번째 release() 는 용량을 두 번 반환하지 않습니다.</p>
     */
    interface Permit {

        /**
         * permit 반환.
         *
         * <p>반드시 try-finally 블록에서 호출되어야 합니다.</p>
         */
        void release();

        /**
         * 이미 반환되었는지 여부.
         *
         * @return true: 반환됨
         */
        boolean isReleased();
    }
}
