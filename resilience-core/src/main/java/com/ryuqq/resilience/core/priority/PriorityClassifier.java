package com.ryuqq.resilience.core.priority;

import com.ryuqq.resilience.core.model.Priority;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 작업 이름 → 우선순위 분류기.
 *
 * <p><strong>평가 순서:</strong></p>
 * <ol>
 *   <li>정확히 일치하는 이름 (exact table)</li>
 *   <li>와일드카드/접두사 규칙 (등록 순서대로 첫 번째 일치)</li>
 *   <li>기본 우선순위 (NORMAL)</li>
 * </ol>
 *
 * <p>불변 객체이므로 스레드 안전합니다. 기본 테이블은
 * {@link OperationPriorities#defaults()} 가 제공하며,
 * {@link #toBuilder()} 로 확장할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PriorityClassifier classifier = OperationPriorities.defaults().toBuilder()
 *     .rule("billing:*", Priority.HIGH)
 *     .build();
 *
 * classifier.classify("billing:charge"); // HIGH
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PriorityClassifier {

    private final Map<String, Priority> exact;
    private final List<PriorityRule> wildcards;
    private final Priority defaultPriority;

    private PriorityClassifier(Builder builder) {
        this.exact = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exact));
        this.wildcards = List.copyOf(builder.wildcards);
        this.defaultPriority = builder.defaultPriority;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 규칙을 복사한 빌더 생성.
     *
     * @return 이 분류기의 규칙이 채워진 빌더
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.exact.putAll(exact);
        builder.wildcards.addAll(wildcards);
        builder.defaultPriority = defaultPriority;
        return builder;
    }

    /**
     * 작업 이름의 우선순위 결정.
     *
     * @param operationName 작업 이름 (예: "memory:remember")
     * @return 우선순위 (일치 규칙이 없으면 기본 우선순위)
     * @throws IllegalArgumentException operationName이 null인 경우
     */
    public Priority classify(String operationName) {
        if (operationName == null) {
            throw new IllegalArgumentException("operationName cannot be null");
        }
        Priority priority = exact.get(operationName);
        if (priority != null) {
            return priority;
        }
        for (PriorityRule rule : wildcards) {
            if (rule.matches(operationName)) {
                return rule.priority();
            }
        }
        return defaultPriority;
    }

    public boolean isCritical(String operationName) {
        return classify(operationName) == Priority.CRITICAL;
    }

    /**
     * 특정 우선순위로 매핑된 작업 이름과 패턴 목록.
     *
     * <p>정확히 일치하는 이름을 등록 순서대로 먼저 담고, 이어서 와일드카드 패턴
     * (예: {@code "graphSync:*"})을 등록 순서대로 담습니다.</p>
     *
     * @param priority 우선순위
     * @return 작업 이름과 패턴 목록 (불변)
     */
    public List<String> operationsFor(Priority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Priority> entry : exact.entrySet()) {
            if (entry.getValue() == priority) {
                names.add(entry.getKey());
            }
        }
        for (PriorityRule rule : wildcards) {
            if (rule.priority() == priority) {
                names.add(rule.pattern());
            }
        }
        return Collections.unmodifiableList(names);
    }

    public List<PriorityRule> wildcardRules() {
        return wildcards;
    }

    public Priority defaultPriority() {
        return defaultPriority;
    }

    /**
     * {@link PriorityClassifier} 빌더.
     */
    public static final class Builder {

        private final Map<String, Priority> exact = new LinkedHashMap<>();
        private final List<PriorityRule> wildcards = new ArrayList<>();
        private Priority defaultPriority = Priority.NORMAL;

        private Builder() {
        }

        /**
         * 규칙 추가.
         *
         * <p>{@code '*'} 로 끝나는 패턴은 와일드카드 규칙, 그 외는 정확히 일치 규칙입니다.
         * 같은 정확히 일치 이름을 다시 등록하면 덮어씁니다.</p>
         *
         * @param pattern 작업 이름 또는 패턴
         * @param priority 우선순위
         * @return this
         */
        public Builder rule(String pattern, Priority priority) {
            PriorityRule rule = new PriorityRule(pattern, priority);
            if (rule.isExact()) {
                exact.put(pattern, priority);
            } else {
                wildcards.removeIf(existing -> existing.pattern().equals(pattern));
                wildcards.add(rule);
            }
            return this;
        }

        public Builder rules(Map<String, Priority> rules) {
            if (rules == null) {
                throw new IllegalArgumentException("rules cannot be null");
            }
            rules.forEach(this::rule);
            return this;
        }

        public Builder defaultPriority(Priority defaultPriority) {
            if (defaultPriority == null) {
                throw new IllegalArgumentException("defaultPriority cannot be null");
            }
            this.defaultPriority = defaultPriority;
            return this;
        }

        public PriorityClassifier build() {
            return new PriorityClassifier(this);
        }
    }
}
