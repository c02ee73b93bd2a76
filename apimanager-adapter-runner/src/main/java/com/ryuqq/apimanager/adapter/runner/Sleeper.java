package com.ryuqq.apimanager.adapter.runner;

import java.time.Duration;

/**
 * 대기 전략.
 *
 * <p>테스트에서는 실제로 잠들지 않는 구현으로 교체합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread.sleep 기반 기본 구현.
     */
    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    /**
     * 지정 시간 동안 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;
}
