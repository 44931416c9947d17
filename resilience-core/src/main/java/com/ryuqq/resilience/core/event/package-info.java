/**
 * Resilience 이벤트 리스너 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.event;
