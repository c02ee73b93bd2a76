package com.ryuqq.apimanager.core.quota;

import com.ryuqq.apimanager.core.clock.QuotaClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 고정 시간 window 기반 호출 수 승인 제어.
 *
 * <p><strong>상태:</strong></p>
 * <ul>
 *   <li>count: 현재 window에 기록된 호출 수 (상한 없음, 제한은 승인 정책이 담당)</li>
 *   <li>inFlight: {@link #tryAcquire()}로 예약되었지만 아직 기록되지 않은 호출 수</li>
 *   <li>windowStart: 현재 window 시작 시각 (생성 시각으로 초기화)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> {@code now - windowStart >= window}이면 다음 승인 검사에서
 * {@code count = 0}, {@code windowStart = now}로 재설정한 뒤 평가합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 상태 변경은 인스턴스 락으로 직렬화</li>
 *   <li>{@link #tryAcquire()}는 승인 검사와 슬롯 예약을 하나의 임계 구역에서 수행하므로,
 *       동시 호출자가 함께 threshold를 초과할 수 없음</li>
 *   <li>{@link #admit()}은 예약 없이 결과만 알려주는 권고용 검사</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * QuotaWindow window = new QuotaWindow(new QuotaConfig(Duration.ofHours(1), 5000), SystemQuotaClock.instance());
 *
 * Optional<QuotaPermit> permit = window.tryAcquire();
 * if (permit.isEmpty()) {
 *     // Rate Limit 초과
 * }
 * try {
 *     client.request(...);
 * } finally {
 *     permit.get().record();
 * }
 * }</pre>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class QuotaWindow {

    private static final Logger log = LoggerFactory.getLogger(QuotaWindow.class);

    private final QuotaConfig config;
    private final QuotaClock clock;
    private final Duration window;

    private int count;
    private int inFlight;
    private long generation;
    private Instant windowStart;

    /**
     * 생성자.
     *
     * @param config quota 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QuotaWindow(QuotaConfig config, QuotaClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.window = config.effectiveWindow();
        this.windowStart = clock.now();
    }

    /**
     * 호출 승인 여부 확인 (권고용, count 변경 없음).
     *
     * <p>window가 경과했다면 먼저 재설정한 뒤 평가합니다.</p>
     *
     * @return count + inFlight &lt; threshold이면 true
     */
    public synchronized boolean admit() {
        rollIfElapsed();
        return count + inFlight < config.threshold();
    }

    /**
     * 승인 검사와 슬롯 예약을 원자적으로 수행.
     *
     * @return 승인된 경우 QuotaPermit, 거부된 경우 empty
     */
    public synchronized Optional<QuotaPermit> tryAcquire() {
        rollIfElapsed();
        if (count + inFlight >= config.threshold()) {
            return Optional.empty();
        }
        inFlight++;
        return Optional.of(new QuotaPermit(this, generation));
    }

    /**
     * 호출 1건 기록 (count 1 증가).
     *
     * <p>{@link #admit()}으로 승인된 라이브 호출마다, 호출 시도 후 정확히 한 번 호출해야 합니다.</p>
     */
    public synchronized void record() {
        count++;
    }

    /**
     * count 직접 덮어쓰기 (외부 재동기화용).
     *
     * <p>windowStart는 변경하지 않으며, threshold를 초과하는 값도 그대로 허용합니다.
     * 이 경우 window가 경과할 때까지 승인이 거부됩니다.</p>
     *
     * @param newCount 새 count 값 (0 이상)
     * @throws IllegalArgumentException newCount가 음수인 경우
     */
    public synchronized void setCount(int newCount) {
        if (newCount < 0) {
            throw new IllegalArgumentException("count must not be negative (current: " + newCount + ")");
        }
        log.debug("Quota count overridden: {} → {}", count, newCount);
        count = newCount;
    }

    /**
     * 원격 서비스가 한도 도달을 알린 경우 현재 window를 소진 상태로 표시.
     */
    public synchronized void exhaust() {
        if (count < config.threshold()) {
            count = config.threshold();
        }
    }

    /**
     * 현재 상태 스냅샷 (window 재설정 없음).
     *
     * @return QuotaSnapshot
     */
    public synchronized QuotaSnapshot snapshot() {
        return new QuotaSnapshot(count, inFlight, config.threshold(), windowStart, window);
    }

    /**
     * 현재 window 재설정까지 남은 시간.
     *
     * @return 남은 시간 (경과한 경우 {@link Duration#ZERO})
     */
    public Duration remainingTime() {
        return snapshot().remainingTime(clock.now());
    }

    /**
     * 현재 window의 남은 호출 수.
     *
     * <p>window가 경과했다면 재설정 후 계산합니다.</p>
     *
     * @return 남은 호출 수 (0 이상)
     */
    public synchronized int remainingCalls() {
        rollIfElapsed();
        return Math.max(0, config.threshold() - count - inFlight);
    }

    public synchronized int getCount() {
        return count;
    }

    public synchronized Instant getWindowStart() {
        return windowStart;
    }

    public Duration getWindowDuration() {
        return window;
    }

    public int getThreshold() {
        return config.threshold();
    }

    public QuotaConfig getConfig() {
        return config;
    }

    /**
     * 예약된 슬롯을 기록된 호출로 전환.
     *
     * <p>이전 window에서 발급된 예약은 새 window의 count에 반영하지 않습니다.</p>
     *
     * @param permitGeneration 예약 발급 시점의 window 세대
     */
    synchronized void complete(long permitGeneration) {
        if (permitGeneration != generation) {
            log.debug("Dropped permit from elapsed window (generation {} < {})", permitGeneration, generation);
            return;
        }
        inFlight--;
        count++;
    }

    private void rollIfElapsed() {
        Instant now = clock.now();
        if (Duration.between(windowStart, now).compareTo(window) >= 0) {
            log.info("Quota window elapsed: resetting count {} (started at {})", count, windowStart);
            count = 0;
            inFlight = 0;
            generation++;
            windowStart = now;
        }
    }
}
