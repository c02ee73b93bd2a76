package com.ryuqq.apimanager.core.exception;

/**
 * API 클라이언트 호출 실패 (네트워크 오류 또는 클라이언트가 정의한 비성공 응답).
 *
 * <p>호출이 네트워크에 도달했으므로 quota는 소비된 것으로 간주합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public class TransportFailureException extends ApiManagerException {

    public static final String ERROR_CODE = "TRANSPORT";

    private final int statusCode;

    public TransportFailureException(String message, Throwable cause) {
        this(ERROR_CODE, message, -1, cause);
    }

    public TransportFailureException(String message, int statusCode) {
        this(ERROR_CODE, message, statusCode, null);
    }

    protected TransportFailureException(String errorCode, String message, int statusCode, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 원격 응답 상태 코드.
     *
     * @return 상태 코드, 응답을 받지 못한 경우 -1
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode >= 0;
    }
}
