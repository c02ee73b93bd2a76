package com.ryuqq.apimanager.core.fingerprint;

import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.model.Fingerprint;
import com.ryuqq.apimanager.core.model.HttpMethod;

import java.util.Map;

/**
 * 논리 요청 → 캐시 키 변환기.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>결정성: 의미적으로 동일한 요청(같은 method, endpoint, 삽입 순서와 무관하게 같은 params, 같은 body)은
 *       항상 같은 Fingerprint를 반환</li>
 *   <li>충돌 저항성: 다른 요청은 압도적 확률로 다른 Fingerprint를 반환</li>
 *   <li>전역 함수: 어떤 입력에 대해서도 예외를 던지지 않음 (null request 제외)</li>
 *   <li>자기 자신을 포함하는 Map/컬렉션도 순환 토큰으로 인코딩되어 무한 재귀하지 않음</li>
 * </ul>
 *
 * <p>헤더는 기본적으로 제외됩니다. 호출자마다 다른 Authorization 헤더가 캐시를 분할하지 않도록 하기 위함이며,
 * 응답 내용에 영향을 주는 헤더(예: Accept-Language)는 구현체 설정으로 포함시킬 수 있습니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public interface Fingerprinter {

    /**
     * 요청의 Fingerprint 계산.
     *
     * @param request 논리 요청
     * @return Fingerprint
     * @throws IllegalArgumentException request가 null인 경우
     */
    Fingerprint fingerprint(ApiRequest request);

    /**
     * 개별 필드로 Fingerprint 계산.
     *
     * @param method HTTP 메서드
     * @param endpoint 엔드포인트
     * @param params 파라미터 (null 허용)
     * @param body 본문 (null 허용)
     * @return Fingerprint
     */
    default Fingerprint fingerprint(HttpMethod method, String endpoint, Map<String, Object> params, Map<String, Object> body) {
        return fingerprint(ApiRequest.of(method, endpoint, null, params, body));
    }
}
