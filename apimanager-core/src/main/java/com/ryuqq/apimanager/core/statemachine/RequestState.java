package com.ryuqq.apimanager.core.statemachine;

/**
 * 논리 요청 1건의 처리 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CHECK_RESYNC
 *    │
 *    ▼
 * CHECK_CACHE ──(적중)──────────────┐
 *    │                              │
 *    ▼                              │
 * CHECK_QUOTA ──(거부)──► FAILED    │
 *    │                     ▲        │
 *    ▼                     │        │
 *  CALL ───(실패)──────────┤        │
 *    │                     │        │
 *    ▼                     │        │
 *  UPDATE ─(캐시 실패)─────┘        │
 *    │                              │
 *    ▼                              │
 *  RETURN ◄─────────────────────────┘
 * </pre>
 *
 * <p>모든 비종료 상태에서 FAILED로 전이할 수 있습니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public enum RequestState {

    /**
     * 재동기화 (선택).
     */
    CHECK_RESYNC,

    /**
     * 캐시 조회.
     */
    CHECK_CACHE,

    /**
     * quota 승인 검사.
     */
    CHECK_QUOTA,

    /**
     * 라이브 호출.
     */
    CALL,

    /**
     * 캐시 저장 및 quota 기록.
     */
    UPDATE,

    /**
     * 응답 반환 (성공).
     */
    RETURN,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RETURN 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == RETURN || this == FAILED;
    }
}
