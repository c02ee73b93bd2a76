package com.ryuqq.apimanager.core.quota;

import java.time.Duration;

/**
 * Quota window 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>windowDuration: 한 quota 기간의 길이 (예: 1시간)</li>
 *   <li>threshold: 기간 내 최대 호출 수</li>
 *   <li>windowBuffer: 원격 서비스와의 시계 오차를 흡수하기 위해 windowDuration에 더하는 여유 시간 (기본 0)</li>
 * </ul>
 *
 * @param windowDuration quota 기간 (양수)
 * @param threshold 기간 내 최대 호출 수 (양수)
 * @param windowBuffer 여유 시간 (0 이상)
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public record QuotaConfig(Duration windowDuration, int threshold, Duration windowBuffer) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QuotaConfig {
        validate(windowDuration, threshold, windowBuffer);
    }

    /**
     * window 설정값 검증.
     *
     * <p>QuotaConfig를 만들기 전에 같은 규칙으로 검증해야 하는 상위 설정에서도 사용합니다.</p>
     *
     * @param windowDuration quota 기간 (양수)
     * @param threshold 최대 호출 수 (양수)
     * @param windowBuffer 여유 시간 (0 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static void validate(Duration windowDuration, int threshold, Duration windowBuffer) {
        if (windowDuration == null || windowDuration.isZero() || windowDuration.isNegative()) {
            throw new IllegalArgumentException(
                "windowDuration must be positive (current: " + windowDuration + ")"
            );
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException(
                "threshold must be positive (current: " + threshold + ")"
            );
        }
        if (windowBuffer == null || windowBuffer.isNegative()) {
            throw new IllegalArgumentException(
                "windowBuffer must be zero or positive (current: " + windowBuffer + ")"
            );
        }
    }

    /**
     * 여유 시간 없이 생성.
     *
     * @param windowDuration quota 기간
     * @param threshold 최대 호출 수
     */
    public QuotaConfig(Duration windowDuration, int threshold) {
        this(windowDuration, threshold, Duration.ZERO);
    }

    /**
     * 실제로 적용되는 window 길이 (windowDuration + windowBuffer).
     *
     * @return 유효 window 길이
     */
    public Duration effectiveWindow() {
        return windowDuration.plus(windowBuffer);
    }

    /**
     * windowBuffer만 변경한 새 인스턴스 생성.
     *
     * @param windowBuffer 새 여유 시간
     * @return 새 QuotaConfig 인스턴스
     */
    public QuotaConfig withWindowBuffer(Duration windowBuffer) {
        return new QuotaConfig(this.windowDuration, this.threshold, windowBuffer);
    }
}
