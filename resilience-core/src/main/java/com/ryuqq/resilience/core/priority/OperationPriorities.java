package com.ryuqq.resilience.core.priority;

import com.ryuqq.resilience.core.model.Priority;

/**
 * SDK 기본 작업 우선순위 테이블.
 *
 * <ul>
 *   <li><strong>CRITICAL:</strong> GDPR/보안 작업 (지연/폐기 금지)</li>
 *   <li><strong>HIGH:</strong> 실시간 대화 (낮은 지연 필요)</li>
 *   <li><strong>NORMAL:</strong> 일반 CRUD (기본값)</li>
 *   <li><strong>LOW:</strong> 대량 작업 (지연 허용)</li>
 *   <li><strong>BACKGROUND:</strong> 그래프 동기화 (유휴 시 실행)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class OperationPriorities {

    private static final PriorityClassifier DEFAULTS = PriorityClassifier.builder()
        // CRITICAL
        .rule("users:delete", Priority.CRITICAL)
        .rule("users:purge", Priority.CRITICAL)
        .rule("governance:purge", Priority.CRITICAL)
        .rule("governance:deleteUserData", Priority.CRITICAL)
        .rule("governance:executeRetentionPolicy", Priority.CRITICAL)
        // HIGH
        .rule("memory:remember", Priority.HIGH)
        .rule("memory:rememberStream", Priority.HIGH)
        .rule("conversations:create", Priority.HIGH)
        .rule("conversations:addMessage", Priority.HIGH)
        .rule("conversations:update", Priority.HIGH)
        .rule("a2a:sendMessage", Priority.HIGH)
        .rule("a2a:broadcast", Priority.HIGH)
        // NORMAL
        .rule("memory:search", Priority.NORMAL)
        .rule("memory:get", Priority.NORMAL)
        .rule("memory:store", Priority.NORMAL)
        .rule("memory:update", Priority.NORMAL)
        .rule("memory:delete", Priority.NORMAL)
        .rule("memory:list", Priority.NORMAL)
        .rule("memory:count", Priority.NORMAL)
        .rule("conversations:get", Priority.NORMAL)
        .rule("conversations:list", Priority.NORMAL)
        .rule("conversations:delete", Priority.NORMAL)
        .rule("facts:store", Priority.NORMAL)
        .rule("facts:get", Priority.NORMAL)
        .rule("facts:search", Priority.NORMAL)
        .rule("facts:update", Priority.NORMAL)
        .rule("facts:delete", Priority.NORMAL)
        .rule("facts:list", Priority.NORMAL)
        .rule("contexts:create", Priority.NORMAL)
        .rule("contexts:get", Priority.NORMAL)
        .rule("contexts:update", Priority.NORMAL)
        .rule("contexts:delete", Priority.NORMAL)
        .rule("vector:store", Priority.NORMAL)
        .rule("vector:search", Priority.NORMAL)
        .rule("vector:get", Priority.NORMAL)
        .rule("vector:update", Priority.NORMAL)
        .rule("vector:delete", Priority.NORMAL)
        .rule("immutable:append", Priority.NORMAL)
        .rule("immutable:get", Priority.NORMAL)
        .rule("immutable:list", Priority.NORMAL)
        .rule("mutable:set", Priority.NORMAL)
        .rule("mutable:get", Priority.NORMAL)
        .rule("mutable:delete", Priority.NORMAL)
        .rule("users:create", Priority.NORMAL)
        .rule("users:get", Priority.NORMAL)
        .rule("users:update", Priority.NORMAL)
        .rule("users:list", Priority.NORMAL)
        .rule("agents:create", Priority.NORMAL)
        .rule("agents:get", Priority.NORMAL)
        .rule("agents:update", Priority.NORMAL)
        .rule("agents:delete", Priority.NORMAL)
        .rule("agents:list", Priority.NORMAL)
        .rule("memorySpaces:create", Priority.NORMAL)
        .rule("memorySpaces:get", Priority.NORMAL)
        .rule("memorySpaces:update", Priority.NORMAL)
        .rule("memorySpaces:delete", Priority.NORMAL)
        .rule("memorySpaces:list", Priority.NORMAL)
        .rule("a2a:get", Priority.NORMAL)
        .rule("a2a:list", Priority.NORMAL)
        .rule("a2a:subscribe", Priority.NORMAL)
        // LOW
        .rule("memory:export", Priority.LOW)
        .rule("memory:deleteMany", Priority.LOW)
        .rule("memory:updateMany", Priority.LOW)
        .rule("memory:archive", Priority.LOW)
        .rule("memory:restoreFromArchive", Priority.LOW)
        .rule("facts:deleteMany", Priority.LOW)
        .rule("facts:updateMany", Priority.LOW)
        .rule("facts:export", Priority.LOW)
        .rule("conversations:deleteMany", Priority.LOW)
        .rule("conversations:export", Priority.LOW)
        .rule("vector:deleteMany", Priority.LOW)
        .rule("vector:updateMany", Priority.LOW)
        .rule("governance:listPolicies", Priority.LOW)
        .rule("governance:createPolicy", Priority.LOW)
        .rule("governance:updatePolicy", Priority.LOW)
        // BACKGROUND
        .rule("graphSync:*", Priority.BACKGROUND)
        .rule("graph:sync", Priority.BACKGROUND)
        .rule("graph:batchSync", Priority.BACKGROUND)
        .build();

    private OperationPriorities() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 분류기 (불변 공유 인스턴스).
     *
     * @return 기본 테이블을 가진 분류기
     */
    public static PriorityClassifier defaults() {
        return DEFAULTS;
    }
}
