/**
 * 요청 처리 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.apimanager.core.statemachine.RequestState}는 논리 요청 1건이 거치는 단계를,
 * {@link com.ryuqq.apimanager.core.statemachine.StateTransition}은 허용된 전이 규칙을 정의합니다.</p>
 *
 * <pre>
 * CHECK_RESYNC → CHECK_CACHE → CHECK_QUOTA → CALL → UPDATE → RETURN
 *                     │              │         │       │
 *                     └──► RETURN    └─────────┴───────┴──► FAILED
 * </pre>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.core.statemachine;
