/**
 * Resilience 진입점 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.gate;
