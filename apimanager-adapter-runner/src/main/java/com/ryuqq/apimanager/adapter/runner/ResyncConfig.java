package com.ryuqq.apimanager.adapter.runner;

/**
 * QuotaResyncScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialDelayMs: 첫 재동기화까지 지연 (기본 0)</li>
 *   <li>intervalMs: 재동기화 주기 (기본 60000ms = 1분)</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 * @param initialDelayMs 초기 지연 (밀리초, 0 이상)
 * @param intervalMs 재동기화 주기 (밀리초, 양수여야 함)
 */
public record ResyncConfig(long initialDelayMs, long intervalMs) {

    public ResyncConfig() {
        this(0, 60000);
    }

    public ResyncConfig {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must not be negative (current: " + initialDelayMs + ")"
            );
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
    }

    public ResyncConfig withIntervalMs(long intervalMs) {
        return new ResyncConfig(this.initialDelayMs, intervalMs);
    }
}
