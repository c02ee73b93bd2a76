/**
 * API Manager 패키지.
 *
 * <p>호출자가 사용하는 공개 표면을 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.apimanager.application.manager.ApiManager} - 논리 요청 실행 인터페이스</li>
 *   <li>{@link com.ryuqq.apimanager.application.manager.DefaultApiManager} - 캐시/quota 오케스트레이터</li>
 *   <li>{@link com.ryuqq.apimanager.application.manager.ApiManagerConfig} - 설정</li>
 *   <li>{@link com.ryuqq.apimanager.application.manager.RequestStats} - 누적 통계</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.application.manager;
