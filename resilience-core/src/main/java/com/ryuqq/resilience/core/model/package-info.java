/**
 * 도메인 모델 패키지.
 *
 * <p>우선순위 티어({@link com.ryuqq.resilience.core.model.Priority})와
 * 요청 식별자({@link com.ryuqq.resilience.core.model.RequestId}) 같은
 * 불변 값 객체를 정의합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
