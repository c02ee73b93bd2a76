package com.ryuqq.apimanager.core.exception;

import com.ryuqq.apimanager.core.quota.QuotaSnapshot;

import java.time.Duration;

/**
 * 로컬 quota window가 호출을 거부한 경우.
 *
 * <p>네트워크 호출은 발생하지 않았고 quota도 소비되지 않았습니다.
 * 호출자는 {@link #getRetryAfter()} 동안 대기한 뒤 재시도할 수 있습니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends ApiManagerException {

    public static final String ERROR_CODE = "RATE-LIMIT";

    private final transient QuotaSnapshot quota;
    private final Duration retryAfter;

    /**
     * 생성자.
     *
     * @param quota 거부 시점의 quota 스냅샷
     * @param retryAfter window 재설정까지 남은 시간
     * @throws IllegalArgumentException quota 또는 retryAfter가 null인 경우
     */
    public RateLimitExceededException(QuotaSnapshot quota, Duration retryAfter) {
        super(ERROR_CODE, buildMessage(quota, retryAfter));
        this.quota = quota;
        this.retryAfter = retryAfter;
    }

    private static String buildMessage(QuotaSnapshot quota, Duration retryAfter) {
        if (quota == null) {
            throw new IllegalArgumentException("quota cannot be null");
        }
        if (retryAfter == null) {
            throw new IllegalArgumentException("retryAfter cannot be null");
        }
        return String.format("Rate limit exceeded: %d/%d calls in window, retry after %d ms",
            quota.count() + quota.inFlight(), quota.threshold(), retryAfter.toMillis());
    }

    public QuotaSnapshot getQuota() {
        return quota;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
