package com.ryuqq.resilience.core.priority;

import com.ryuqq.resilience.core.model.Priority;

/**
 * 작업 이름 패턴 → 우선순위 규칙.
 *
 * <p><strong>패턴 형식:</strong></p>
 * <ul>
 *   <li>{@code "memory:remember"}: 정확히 일치</li>
 *   <li>{@code "graphSync:*"}: 네임스페이스 와일드카드 (첫 번째 {@code ':'} 앞 부분이 같은 모든 작업)</li>
 *   <li>{@code "graph*"}: 접두사 일치</li>
 * </ul>
 *
 * @param pattern 작업 이름 패턴
 * @param priority 일치 시 적용할 우선순위
 * @author Resilience Team
 * @since 1.0.0
 */
public record PriorityRule(String pattern, Priority priority) {

    private static final String NAMESPACE_WILDCARD = ":*";

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException pattern이 비었거나 priority가 null인 경우
     */
    public PriorityRule {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (pattern.equals("*") || pattern.equals(NAMESPACE_WILDCARD)) {
            throw new IllegalArgumentException("pattern must have a non-empty prefix (current: " + pattern + ")");
        }
        if (pattern.indexOf('*') >= 0 && pattern.indexOf('*') != pattern.length() - 1) {
            throw new IllegalArgumentException("wildcard is only allowed as the last character (current: " + pattern + ")");
        }
    }

    public boolean isExact() {
        return !pattern.endsWith("*");
    }

    /**
     * 작업 이름이 이 규칙과 일치하는지 확인.
     *
     * @param operationName 작업 이름
     * @return 일치하면 true
     */
    public boolean matches(String operationName) {
        if (operationName == null) {
            return false;
        }
        if (isExact()) {
            return pattern.equals(operationName);
        }
        if (pattern.endsWith(NAMESPACE_WILDCARD)) {
            String namespace = pattern.substring(0, pattern.length() - NAMESPACE_WILDCARD.length());
            return namespace.equals(namespaceOf(operationName));
        }
        return operationName.startsWith(pattern.substring(0, pattern.length() - 1));
    }

    private static String namespaceOf(String operationName) {
        int separator = operationName.indexOf(':');
        return separator < 0 ? operationName : operationName.substring(0, separator);
    }
}
