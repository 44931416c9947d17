package com.ryuqq.resilience.core.model;

import java.util.List;

/**
 * 요청 우선순위 티어.
 *
 * <p>큐 정렬과 부하 차단(load shedding) 판단에 사용되는 닫힌 열거형입니다.
 * 선언 순서가 곧 처리 순서입니다 (CRITICAL 이 가장 먼저).</p>
 *
 * <ul>
 *   <li>CRITICAL: GDPR/보안 작업 (절대 조용히 버려지지 않음)</li>
 *   <li>HIGH: 실시간 대화 저장</li>
 *   <li>NORMAL: 일반 읽기/쓰기 (기본값)</li>
 *   <li>LOW: 대량 작업, export</li>
 *   <li>BACKGROUND: 비동기 동기화, 분석</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum Priority {

    CRITICAL("critical"),
    HIGH("high"),
    NORMAL("normal"),
    LOW("low"),
    BACKGROUND("background");

    /**
     * 처리 순서 (가장 높은 우선순위부터).
     */
    public static final List<Priority> PROCESSING_ORDER = List.of(values());

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    /**
     * 외부 노출용 소문자 라벨 조회.
     *
     * @return 라벨 (예: "critical")
     */
    public String label() {
        return label;
    }

    /**
     * 이 티어가 다른 티어보다 먼저 처리되는지 여부.
     *
     * @param other 비교 대상
     * @return true: 이 티어가 더 높은 우선순위
     */
    public boolean isHigherThan(Priority other) {
        return this.ordinal() < other.ordinal();
    }

    /**
     * 라벨로 티어 조회 (대소문자 무시).
     *
     * @param label 라벨 (예: "high")
     * @return 해당 Priority
     * @throws IllegalArgumentException 알 수 없는 라벨인 경우
     */
    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Priority label cannot be null or blank");
        }
        for (Priority priority : values()) {
            if (priority.label.equalsIgnoreCase(label.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority label: " + label);
    }
}
