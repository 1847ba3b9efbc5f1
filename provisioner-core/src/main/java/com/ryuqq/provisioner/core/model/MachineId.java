package com.ryuqq.provisioner.core.model;

/**
 * 머신 식별자 ("m-" 접두사 + 클라우드 리소스 ID 또는 생성된 ID).
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
public final class MachineId {

    private static final String PREFIX = "m-";

    private final String value;

    private MachineId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MachineId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("MachineId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("MachineId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * MachineId 생성.
     *
     * @param value 식별자 값
     * @return MachineId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MachineId of(String value) {
        return new MachineId(value);
    }

    /**
     * 클라우드 리소스 ID로부터 MachineId 생성.
     *
     * <p>이미 "m-" 접두사를 가진 값은 그대로 사용합니다.</p>
     *
     * @param resourceId 클라우드 리소스 ID
     * @return MachineId 인스턴스
     */
    public static MachineId fromResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId cannot be null or blank");
        }
        return new MachineId(resourceId.startsWith(PREFIX) ? resourceId : PREFIX + resourceId);
    }

    /**
     * 접두사를 제거한 클라우드 리소스 ID.
     *
     * @return 리소스 ID
     */
    public String resourceId() {
        return value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MachineId that = (MachineId) o;
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
