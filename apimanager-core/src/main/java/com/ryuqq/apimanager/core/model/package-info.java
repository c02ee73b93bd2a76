/**
 * API Manager 도메인 값 객체 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.apimanager.core.model.ApiRequest} - 논리 요청 (method, endpoint, headers, params, body)</li>
 *   <li>{@link com.ryuqq.apimanager.core.model.HttpMethod} - HTTP 메서드</li>
 *   <li>{@link com.ryuqq.apimanager.core.model.Fingerprint} - 요청에서 파생된 캐시 키</li>
 * </ul>
 *
 * <p>모든 타입은 불변이며 생성 시점에 유효성을 검증합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.core.model;
