package com.ryuqq.apimanager.application.manager;

import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.model.HttpMethod;
import com.ryuqq.apimanager.core.quota.QuotaSnapshot;

import java.util.Map;

/**
 * Rate-limit 및 캐시를 투명하게 처리하는 원격 API 요청 관리자.
 *
 * <p>호출자는 quota window를 추적하거나 변경되지 않은 데이터를 다시 조회할 필요 없이
 * 논리 요청만 발행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ApiManager&lt;String&gt; manager = new DefaultApiManager&lt;&gt;(config, client, cache);
 *
 * try {
 *     String body = manager.request(ApiRequest.get("/v1/rate_limit"));
 * } catch (RateLimitExceededException e) {
 *     // e.getRetryAfter() 동안 대기 후 재시도
 * }
 * </pre>
 *
 * @param <T> 응답 타입
 * @author API Manager Team
 * @since 1.0.0
 */
public interface ApiManager<T> {

    /**
     * 논리 요청 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>(설정 시) quota 재동기화</li>
     *   <li>Fingerprint 계산</li>
     *   <li>캐시 적중 시 즉시 반환 (quota 변화 없음)</li>
     *   <li>quota 승인 거부 시 RateLimitExceededException</li>
     *   <li>라이브 호출 → 캐시 저장 → quota 기록 → 응답 반환</li>
     * </ol>
     *
     * @param request 논리 요청
     * @return 응답 (캐시된 값 또는 라이브 응답)
     * @throws IllegalArgumentException request가 null인 경우
     * @throws com.ryuqq.apimanager.core.exception.RateLimitExceededException quota 초과
     * @throws com.ryuqq.apimanager.core.exception.CacheFailureException 캐시 실패
     * @throws RuntimeException 클라이언트 실패 (그대로 전파)
     */
    T request(ApiRequest request);

    /**
     * 개별 필드로 논리 요청 실행.
     *
     * @param method HTTP 메서드
     * @param endpoint 엔드포인트
     * @param headers 헤더 (null 허용)
     * @param params 파라미터 (null 허용)
     * @param body 본문 (null 허용)
     * @return 응답
     */
    default T request(
        HttpMethod method,
        String endpoint,
        Map<String, String> headers,
        Map<String, Object> params,
        Map<String, Object> body
    ) {
        return request(ApiRequest.of(method, endpoint, headers, params, body));
    }

    /**
     * 외부 신호로 quota 상태 재동기화.
     *
     * <p>설정된 QuotaSynchronizer를 호출합니다. 기본 구현은 아무 것도 하지 않습니다.</p>
     */
    void resync();

    /**
     * 현재 quota 상태 조회.
     *
     * @return QuotaSnapshot
     */
    QuotaSnapshot quota();

    /**
     * 누적 요청 통계 조회.
     *
     * @return RequestStats
     */
    RequestStats stats();
}
