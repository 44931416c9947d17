package com.ryuqq.resilience.core.model;

import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 대기 중인 요청의 프로세스 내 고유 식별자.
 *
 * <p>큐에 들어간 요청을 취소하거나 로그에서 추적할 때 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 최대 64자 ({@code req_} + 13자리 epoch millis + 순번이 여유 있게 들어가는 크기)</li>
 *   <li>영문자로 시작하고, 이후 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RequestId {

    static final int MAX_LENGTH = 64;

    private static final Pattern FORMAT = Pattern.compile("[a-zA-Z][a-zA-Z0-9_-]*");
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "requestId must be at most " + MAX_LENGTH + " characters (current: " + value.length() + ")");
        }
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "requestId must start with a letter followed by letters, digits, '-' or '_' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * RequestId 생성.
     *
     * @param value RequestId 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 다음 순번 RequestId 발급 (req_{epochMillis}_{seq}).
     *
     * @param nowMillis 현재 시각 (밀리초)
     * @return 새 RequestId
     */
    public static RequestId next(long nowMillis) {
        return new RequestId("req_" + nowMillis + "_" + SEQUENCE.incrementAndGet());
    }

    /**
     * RequestId 값 조회.
     *
     * @return RequestId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId that = (RequestId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
