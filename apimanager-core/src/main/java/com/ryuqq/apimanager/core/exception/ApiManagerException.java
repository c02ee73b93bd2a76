package com.ryuqq.apimanager.core.exception;

/**
 * API Manager 요청 실패의 최상위 예외.
 *
 * <p>모든 하위 예외는 unchecked이며, 안정적인 오류 코드를 가집니다.</p>
 *
 * <ul>
 *   <li>{@link RateLimitExceededException}: {@code RATE-LIMIT} - 로컬 승인 거부</li>
 *   <li>{@link TransportFailureException}: {@code TRANSPORT} - 클라이언트 호출 실패</li>
 *   <li>{@link RemoteRateLimitException}: {@code REMOTE-RATE-LIMIT} - 원격 서비스가 한도 도달을 알림</li>
 *   <li>{@link CacheFailureException}: {@code CACHE} - 캐시 읽기/쓰기 실패</li>
 * </ul>
 *
 * <p>어떤 예외도 프로세스 치명적이지 않으며, 모두 개별 요청 단위입니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public class ApiManagerException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public ApiManagerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 원인 없이 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     */
    public ApiManagerException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: RATE-LIMIT)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
