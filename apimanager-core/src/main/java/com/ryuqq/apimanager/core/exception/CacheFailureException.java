package com.ryuqq.apimanager.core.exception;

/**
 * 캐시 읽기/쓰기 실패.
 *
 * <p>캐시 읽기 실패 시 라이브 호출로 우회하지 않고 실패를 그대로 전파합니다.
 * 캐시 장애가 원격 API 부하 급증으로 가려지지 않도록 하기 위함입니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public class CacheFailureException extends ApiManagerException {

    public static final String ERROR_CODE = "CACHE";

    public CacheFailureException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public CacheFailureException(String message) {
        super(ERROR_CODE, message);
    }
}
