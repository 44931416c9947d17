/**
 * Resilience 설정 패키지.
 *
 * <p>{@link com.ryuqq.resilience.application.config.ResilienceConfig} 와
 * 시나리오별 프리셋({@link com.ryuqq.resilience.application.config.ResiliencePresets})을 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.config;
