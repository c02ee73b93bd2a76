package com.ryuqq.apimanager.core.model;

import java.util.Locale;

/**
 * 논리 요청의 HTTP 메서드.
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public enum HttpMethod {

    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * 문자열에서 HttpMethod 파싱 (대소문자 무시).
     *
     * @param value 메서드 이름 (예: "get", "POST")
     * @return HttpMethod
     * @throws IllegalArgumentException value가 null, 빈 문자열이거나 지원하지 않는 메서드인 경우
     */
    public static HttpMethod from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HTTP method cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + value, e);
        }
    }
}
