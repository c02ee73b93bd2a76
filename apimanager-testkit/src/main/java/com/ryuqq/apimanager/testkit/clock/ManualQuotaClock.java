package com.ryuqq.apimanager.testkit.clock;

import com.ryuqq.apimanager.core.clock.QuotaClock;

import java.time.Duration;
import java.time.Instant;

/**
 * 수동으로 진행시키는 {@link QuotaClock}.
 *
 * <p>window 경과 시나리오를 결정적으로 재현하기 위한 테스트용 시계입니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class ManualQuotaClock implements QuotaClock {

    private volatile Instant now;

    public ManualQuotaClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public ManualQuotaClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    /**
     * 시계를 앞으로 진행.
     *
     * @param delta 진행할 시간 (0 이상)
     * @throws IllegalArgumentException delta가 null이거나 음수인 경우
     */
    public synchronized void advance(Duration delta) {
        if (delta == null || delta.isNegative()) {
            throw new IllegalArgumentException("delta must be zero or positive (current: " + delta + ")");
        }
        now = now.plus(delta);
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now = instant;
    }
}
