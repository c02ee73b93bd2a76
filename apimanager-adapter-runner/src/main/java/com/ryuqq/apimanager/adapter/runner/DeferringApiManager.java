package com.ryuqq.apimanager.adapter.runner;

import com.ryuqq.apimanager.application.manager.ApiManager;
import com.ryuqq.apimanager.application.manager.RequestStats;
import com.ryuqq.apimanager.core.exception.RateLimitExceededException;
import com.ryuqq.apimanager.core.exception.RemoteRateLimitException;
import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.quota.QuotaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * quota 거부 시 다음 window까지 대기 후 재시도하는 {@link ApiManager} 래퍼.
 *
 * <p>코어 오케스트레이터는 거부를 즉시 호출자에게 돌려주므로, 대기/재시도가 필요한
 * 배치 작업 등에서 이 래퍼로 감쌉니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. delegate.request(request)
 * 2. RateLimitExceededException → min(retryAfter, maxWait) 대기 후 재시도
 * 3. RemoteRateLimitException (deferOnRemoteLimit=true) → 즉시 재시도
 *    (window가 소진되었으므로 다음 시도는 로컬 거부 → 2번 경로로 대기)
 * 4. maxAttempts 도달 시 마지막 예외 전파
 * 5. 그 외 예외는 그대로 전파
 * </pre>
 *
 * <p>대기 중 인터럽트되면 인터럽트 플래그를 복원하고 원래의 거부 예외를 던집니다.</p>
 *
 * @param <T> 응답 타입
 * @author API Manager Team
 * @since 1.0.0
 */
public final class DeferringApiManager<T> implements ApiManager<T> {

    private static final Logger log = LoggerFactory.getLogger(DeferringApiManager.class);

    private final ApiManager<T> delegate;
    private final DeferralConfig config;
    private final Sleeper sleeper;

    public DeferringApiManager(ApiManager<T> delegate, DeferralConfig config) {
        this(delegate, config, Sleeper.THREAD_SLEEP);
    }

    /**
     * 생성자.
     *
     * @param delegate 실제 요청을 수행할 ApiManager
     * @param config 설정
     * @param sleeper 대기 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeferringApiManager(ApiManager<T> delegate, DeferralConfig config, Sleeper sleeper) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public T request(ApiRequest request) {
        int attempt = 1;
        while (true) {
            try {
                return delegate.request(request);
            } catch (RateLimitExceededException e) {
                if (attempt >= config.maxAttempts()) {
                    log.warn("Giving up on {} {} after {} attempts", describe(request), attempt);
                    throw e;
                }
                Duration wait = boundedWait(e.getRetryAfter());
                log.info("Quota exhausted for {}, waiting {} ms before attempt {}/{}",
                    describe(request), wait.toMillis(), attempt + 1, config.maxAttempts());
                await(wait, e);
            } catch (RemoteRateLimitException e) {
                if (!config.deferOnRemoteLimit() || attempt >= config.maxAttempts()) {
                    throw e;
                }
                log.info("Remote rate limit for {}, deferring to next window (attempt {}/{})",
                    describe(request), attempt + 1, config.maxAttempts());
            }
            attempt++;
        }
    }

    @Override
    public void resync() {
        delegate.resync();
    }

    @Override
    public QuotaSnapshot quota() {
        return delegate.quota();
    }

    @Override
    public RequestStats stats() {
        return delegate.stats();
    }

    public DeferralConfig getConfig() {
        return config;
    }

    private Duration boundedWait(Duration retryAfter) {
        Duration max = Duration.ofMillis(config.maxWaitMs());
        return retryAfter.compareTo(max) > 0 ? max : retryAfter;
    }

    private void await(Duration wait, RateLimitExceededException cause) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }

    private static String describe(ApiRequest request) {
        return request == null ? "null" : request.method() + " " + request.endpoint();
    }
}
