package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 연속 실패를 추적하고,
 * 임계값 도달 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (대기 시간 경과, 다음 호출 시 지연 판정)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► successThreshold 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 정상적으로 처리되며, 연속 실패 수를 추적합니다.</p>
     */
    CLOSED("closed"),

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 호출하지 않고 즉시 거부합니다.
     * 대기 시간이 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN("open"),

    /**
     * 반개방 상태 (제한된 수의 프로브 요청만 통과).
     */
    HALF_OPEN("half-open");

    private final String label;

    CircuitBreakerState(String label) {
        this.label = label;
    }

    /**
     * 외부 노출용 라벨 조회.
     *
     * @return 라벨 (예: "half-open")
     */
    public String label() {
        return label;
    }
}
