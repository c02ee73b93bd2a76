package com.ryuqq.apimanager.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원격 API에 대한 논리 요청.
 *
 * <p>ApiRequest는 실제 네트워크 호출 여부와 무관하게 호출자가 발행하는 요청을 나타냅니다.
 * 캐시 적중 시에는 라이브 호출 없이 캐시된 응답이 반환됩니다.</p>
 *
 * <p><strong>정규화:</strong></p>
 * <ul>
 *   <li>headers, params, body가 null이면 빈 Map으로 대체</li>
 *   <li>모든 Map은 방어적으로 복사되어 변경 불가</li>
 *   <li>Map 값으로 null 허용 (예: {@code ?flag=})</li>
 * </ul>
 *
 * <p><strong>cacheKey:</strong> 지정된 경우 계산된 Fingerprint 대신 캐시 키로 사용됩니다.
 * 동일한 응답을 반환하지만 파라미터 표현이 다른 요청들을 하나의 캐시 항목으로 묶을 때 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ApiRequest request = ApiRequest.builder(HttpMethod.GET, "/v1/repos")
 *     .header("Authorization", "Bearer token")
 *     .param("page", 2)
 *     .param("sort", "updated")
 *     .build();
 * }</pre>
 *
 * @param method HTTP 메서드
 * @param endpoint 엔드포인트 (예: /v1/repos)
 * @param headers 요청 헤더 (Fingerprint에서는 기본적으로 제외)
 * @param params 쿼리 파라미터
 * @param body 요청 본문
 * @param cacheKey 명시적 캐시 키 (선택, null 가능)
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public record ApiRequest(
    HttpMethod method,
    String endpoint,
    Map<String, String> headers,
    Map<String, Object> params,
    Map<String, Object> body,
    String cacheKey
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException method가 null이거나 endpoint가 null/빈 문자열인 경우,
     *                                  cacheKey가 빈 문자열인 경우
     */
    public ApiRequest {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        if (cacheKey != null && cacheKey.isBlank()) {
            throw new IllegalArgumentException("cacheKey cannot be blank");
        }
        headers = immutableCopy(headers);
        params = immutableCopy(params);
        body = immutableCopy(body);
    }

    /**
     * cacheKey 없이 ApiRequest 생성.
     *
     * @param method HTTP 메서드
     * @param endpoint 엔드포인트
     * @param headers 헤더 (null 허용)
     * @param params 파라미터 (null 허용)
     * @param body 본문 (null 허용)
     * @return ApiRequest 인스턴스
     */
    public static ApiRequest of(
        HttpMethod method,
        String endpoint,
        Map<String, String> headers,
        Map<String, Object> params,
        Map<String, Object> body
    ) {
        return new ApiRequest(method, endpoint, headers, params, body, null);
    }

    /**
     * 파라미터 없는 GET 요청 생성.
     *
     * @param endpoint 엔드포인트
     * @return ApiRequest 인스턴스
     */
    public static ApiRequest get(String endpoint) {
        return new ApiRequest(HttpMethod.GET, endpoint, null, null, null, null);
    }

    /**
     * Builder 생성.
     *
     * @param method HTTP 메서드
     * @param endpoint 엔드포인트
     * @return Builder
     */
    public static Builder builder(HttpMethod method, String endpoint) {
        return new Builder(method, endpoint);
    }

    /**
     * 명시적 캐시 키 지정 여부.
     *
     * @return cacheKey가 지정된 경우 true
     */
    public boolean hasCacheKey() {
        return cacheKey != null;
    }

    /**
     * cacheKey만 변경한 새 인스턴스 생성.
     *
     * @param cacheKey 새 캐시 키
     * @return 새 ApiRequest 인스턴스
     */
    public ApiRequest withCacheKey(String cacheKey) {
        return new ApiRequest(method, endpoint, headers, params, body, cacheKey);
    }

    private static <V> Map<String, V> immutableCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * ApiRequest Builder.
     */
    public static final class Builder {

        private final HttpMethod method;
        private final String endpoint;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final Map<String, Object> body = new LinkedHashMap<>();
        private String cacheKey;

        private Builder(HttpMethod method, String endpoint) {
            this.method = method;
            this.endpoint = endpoint;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                headers.putAll(values);
            }
            return this;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder params(Map<String, ?> values) {
            if (values != null) {
                params.putAll(values);
            }
            return this;
        }

        public Builder bodyField(String name, Object value) {
            body.put(name, value);
            return this;
        }

        public Builder body(Map<String, ?> values) {
            if (values != null) {
                body.putAll(values);
            }
            return this;
        }

        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(method, endpoint, headers, params, body, cacheKey);
        }
    }
}
