package com.ryuqq.apimanager.core.exception;

/**
 * 원격 서비스가 자체 rate limit 도달을 응답한 경우 (예: HTTP 429).
 *
 * <p>클라이언트 구현체가 던지며, 오케스트레이터는 호출을 기록한 뒤 현재 window를 소진 상태로 표시합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public class RemoteRateLimitException extends TransportFailureException {

    public static final String ERROR_CODE = "REMOTE-RATE-LIMIT";

    public RemoteRateLimitException(String message, int statusCode) {
        super(ERROR_CODE, message, statusCode, null);
    }

    public RemoteRateLimitException(String message) {
        this(message, -1);
    }
}
