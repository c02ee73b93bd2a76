package com.ryuqq.apimanager.core.quota;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link QuotaWindow#tryAcquire()}로 예약된 호출 슬롯.
 *
 * <p>라이브 호출이 시도된 후 성공/실패와 무관하게 {@link #record()}를 정확히 한 번 호출해야 합니다.
 * 두 번째 이후 호출은 무시됩니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class QuotaPermit {

    private final QuotaWindow window;
    private final long generation;
    private final AtomicBoolean recorded = new AtomicBoolean(false);

    QuotaPermit(QuotaWindow window, long generation) {
        this.window = window;
        this.generation = generation;
    }

    /**
     * 예약을 기록된 호출로 전환.
     *
     * @return 이번 호출로 기록된 경우 true, 이미 기록된 경우 false
     */
    public boolean record() {
        if (!recorded.compareAndSet(false, true)) {
            return false;
        }
        window.complete(generation);
        return true;
    }

    /**
     * 기록 여부.
     *
     * @return 기록된 경우 true
     */
    public boolean isRecorded() {
        return recorded.get();
    }
}
