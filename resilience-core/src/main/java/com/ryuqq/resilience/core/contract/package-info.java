/**
 * 실행 계약 패키지.
 *
 * <p>큐에서 대기하는 요청({@link com.ryuqq.resilience.core.contract.QueuedRequest})을 정의합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.contract;
