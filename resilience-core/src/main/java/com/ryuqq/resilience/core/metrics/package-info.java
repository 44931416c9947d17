/**
 * 지표 스냅샷 패키지.
 *
 * <p>각 보호 요소가 요청 시점에 다시 계산해 돌려주는 읽기 전용 record 들입니다.
 * 독립적인 생명주기는 없습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.metrics;
