package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.metrics.CircuitBreakerMetrics;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>반복적으로 실패하는 의존성 호출을 멈추고(Fail-Fast), 일정 시간 후
 * 제한된 프로브 호출로 복구 여부를 자동으로 확인합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 프로브 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시 (분리 API):</strong></p>
 * <pre>{@code
 * CallPermission permission = cb.acquirePermission(); // OPEN 이면 CircuitOpenException
 * try {
 *     Result result = externalApi.call();
 *     permission.onSuccess();
 *     return result;
 * } catch (Exception e) {
 *     permission.onFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 를 통해 작업 실행.
     *
     * <p>상태가 허용하지 않으면 작업을 호출하지 않고 {@link CircuitOpenException} 을 던집니다.
     * 작업이 던진 예외는 기록 후 그대로 다시 던집니다.</p>
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitOpenException 차단된 경우
     * @throws Exception 작업이 던진 예외 (변형 없음)
     */
    <T> T execute(Callable<T> operation) throws Exception;

    /**
     * 통과 허가 획득.
     *
     * @return 일회용 허가
     * @throws CircuitOpenException OPEN 이거나 HALF_OPEN 프로브 슬롯이 소진된 경우
     */
    CallPermission acquirePermission();

    /**
     * 통과 허가 획득 시도 (예외 없음).
     *
     * @return 허가, 차단 상태면 null
     */
    CallPermission tryAcquirePermission();

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * <p>OPEN 타임아웃이 지났다면 이 호출에서 HALF_OPEN 으로 전이합니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * OPEN 상태 여부.
     *
     * @return true: 요청을 받지 않는 상태
     */
    boolean isOpen();

    /**
     * 지금 호출이 허용되는지 여부 (프로브 슬롯 포함).
     *
     * @return true: 허가 획득 가능
     */
    boolean allowsExecution();

    /**
     * OPEN 타임아웃 만료까지 남은 시간.
     *
     * @return 남은 시간 (밀리초), OPEN 이 아니면 0
     */
    long getTimeUntilCloseMs();

    /**
     * 지표 스냅샷 조회.
     *
     * @return Circuit Breaker 지표
     */
    CircuitBreakerMetrics getMetrics();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋 (카운터 및 지표 초기화).
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * OPEN 상태로 강제 전이 (점검 목적).
     *
     * <p>이미 OPEN 이면 아무 일도 하지 않습니다.</p>
     */
    void forceOpen();

    /**
     * 설정 정보 조회.
     *
     * @return 설정
     */
    CircuitBreakerConfig getConfig();
}
