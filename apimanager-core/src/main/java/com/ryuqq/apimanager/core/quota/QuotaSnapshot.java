package com.ryuqq.apimanager.core.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * Quota window 상태의 불변 스냅샷.
 *
 * <p>호출자는 {@code RateLimitExceededException} 발생 시 이 스냅샷으로 window 재설정까지 남은 시간을
 * 확인하고 백오프할 수 있습니다.</p>
 *
 * @param count 현재 window에 기록된 호출 수
 * @param inFlight 승인되었지만 아직 기록되지 않은 호출 수
 * @param threshold 최대 호출 수
 * @param windowStart 현재 window 시작 시각
 * @param windowDuration 유효 window 길이 (buffer 포함)
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public record QuotaSnapshot(
    int count,
    int inFlight,
    int threshold,
    Instant windowStart,
    Duration windowDuration
) {

    /**
     * 현재 window의 남은 호출 수 (0 이상).
     *
     * @return 남은 호출 수
     */
    public int remainingCalls() {
        return Math.max(0, threshold - count - inFlight);
    }

    /**
     * window 종료 시각.
     *
     * @return windowStart + windowDuration
     */
    public Instant windowEnd() {
        return windowStart.plus(windowDuration);
    }

    /**
     * 주어진 시각 기준 window 재설정까지 남은 시간.
     *
     * @param now 기준 시각
     * @return 남은 시간 (이미 경과한 경우 {@link Duration#ZERO})
     */
    public Duration remainingTime(Instant now) {
        Duration remaining = Duration.between(now, windowEnd());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
