/**
 * 작업 우선순위 분류 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.priority;
