package com.ryuqq.provisioner.core.model;

/**
 * 요청 식별자 (프로비저닝 "req-", 반환 "ret-" 접두사).
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class RequestId {

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RequestId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("RequestId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * RequestId 생성.
     *
     * @param value 식별자 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 요청 유형에 맞는 접두사를 붙여 새 RequestId 생성.
     *
     * @param type 요청 유형
     * @param uniquePart 고유 부분 (예: UUID)
     * @return RequestId 인스턴스
     */
    public static RequestId generate(RequestType type, String uniquePart) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new RequestId(type.getIdPrefix() + uniquePart);
    }

    /**
     * 접두사로부터 요청 유형 추론.
     *
     * @return 요청 유형
     */
    public RequestType inferType() {
        return value.startsWith(RequestType.RETURN.getIdPrefix()) ? RequestType.RETURN : RequestType.PROVISION;
    }

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
        return value;
    }
}
