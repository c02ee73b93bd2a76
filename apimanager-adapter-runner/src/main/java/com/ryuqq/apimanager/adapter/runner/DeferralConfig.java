package com.ryuqq.apimanager.adapter.runner;

/**
 * DeferringApiManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>maxWaitMs: 1회 대기 상한 (기본 60000ms = 1분)</li>
 *   <li>deferOnRemoteLimit: 원격 rate-limit 응답도 재시도 대상으로 볼지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>window가 길고 maxWaitMs가 짧으면 대기 후에도 window가 재설정되지 않아
 * 시도 횟수만 소진될 수 있습니다. maxWaitMs는 windowDuration 이상으로 두는 것을 권장합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param maxWaitMs 1회 대기 상한 (밀리초, 양수여야 함)
 * @param deferOnRemoteLimit RemoteRateLimitException 수신 시 재시도 여부
 */
public record DeferralConfig(int maxAttempts, long maxWaitMs, boolean deferOnRemoteLimit) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, maxWaitMs=60000ms, deferOnRemoteLimit=true</p>
     */
    public DeferralConfig() {
        this(3, 60000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DeferralConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (maxWaitMs <= 0) {
            throw new IllegalArgumentException(
                "maxWaitMs must be positive (current: " + maxWaitMs + ")"
            );
        }
    }

    public DeferralConfig withMaxAttempts(int maxAttempts) {
        return new DeferralConfig(maxAttempts, this.maxWaitMs, this.deferOnRemoteLimit);
    }

    public DeferralConfig withMaxWaitMs(long maxWaitMs) {
        return new DeferralConfig(this.maxAttempts, maxWaitMs, this.deferOnRemoteLimit);
    }

    public DeferralConfig withDeferOnRemoteLimit(boolean deferOnRemoteLimit) {
        return new DeferralConfig(this.maxAttempts, this.maxWaitMs, deferOnRemoteLimit);
    }
}
