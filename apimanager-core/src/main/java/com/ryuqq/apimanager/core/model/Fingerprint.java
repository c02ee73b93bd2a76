package com.ryuqq.apimanager.core.model;

/**
 * 논리 요청의 캐시 키.
 *
 * <p>Fingerprint는 요청의 식별 필드(method, endpoint, params, body)에서 결정적으로
 * 파생되며, 캐시 조회 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~512자</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class Fingerprint {

    private static final int MAX_LENGTH = 512;

    private final String value;

    private Fingerprint(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fingerprint cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Fingerprint length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * Fingerprint 생성.
     *
     * @param value 키 값
     * @return Fingerprint 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Fingerprint of(String value) {
        return new Fingerprint(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fingerprint that = (Fingerprint) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Fingerprint{" + value + '}';
    }
}
