package com.ryuqq.apimanager.application.manager;

import com.ryuqq.apimanager.core.clock.QuotaClock;
import com.ryuqq.apimanager.core.clock.SystemQuotaClock;
import com.ryuqq.apimanager.core.exception.CacheFailureException;
import com.ryuqq.apimanager.core.exception.RateLimitExceededException;
import com.ryuqq.apimanager.core.exception.RemoteRateLimitException;
import com.ryuqq.apimanager.core.fingerprint.CanonicalFingerprinter;
import com.ryuqq.apimanager.core.fingerprint.Fingerprinter;
import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.quota.QuotaPermit;
import com.ryuqq.apimanager.core.quota.QuotaSnapshot;
import com.ryuqq.apimanager.core.quota.QuotaWindow;
import com.ryuqq.apimanager.core.spi.ApiClient;
import com.ryuqq.apimanager.core.spi.QuotaSynchronizer;
import com.ryuqq.apimanager.core.spi.ResponseCache;
import com.ryuqq.apimanager.core.spi.noop.NoOpQuotaSynchronizer;
import com.ryuqq.apimanager.core.statemachine.RequestState;
import com.ryuqq.apimanager.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ApiManager} 기본 구현 (요청 오케스트레이터).
 *
 * <p>논리 요청마다 다음 상태 머신을 수행합니다:</p>
 * <pre>
 * CHECK_RESYNC → CHECK_CACHE → CHECK_QUOTA → CALL → UPDATE → RETURN
 *                     │              │         │       │
 *                     └─(적중)► RETURN └─────────┴───────┴──► FAILED
 * </pre>
 *
 * <p><strong>Quota 규칙:</strong></p>
 * <ul>
 *   <li>캐시 적중은 quota를 소비하지 않음</li>
 *   <li>라이브 호출은 성공/실패와 무관하게 정확히 1회 기록 (원격 서비스가 이미 호출을 셌으므로)</li>
 *   <li>캐시 읽기 실패, 로컬 거부는 quota를 소비하지 않음</li>
 *   <li>RemoteRateLimitException 수신 시 현재 window를 소진 상태로 표시</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>하나의 인스턴스를 여러 스레드가 공유 가능</li>
 *   <li>승인과 슬롯 예약은 {@link QuotaWindow#tryAcquire()}에서 원자적으로 수행되어
 *       window 당 최대 threshold 건만 승인됨</li>
 *   <li>동일 Fingerprint의 동시 캐시 미스는 각각 라이브 호출을 수행함</li>
 * </ul>
 *
 * <p>재시도/백오프는 수행하지 않습니다. 필요하면 상위 래퍼에서 처리합니다.</p>
 *
 * @param <T> 응답 타입
 * @author API Manager Team
 * @since 1.0.0
 */
public final class DefaultApiManager<T> implements ApiManager<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultApiManager.class);

    private final ApiManagerConfig config;
    private final ApiClient<T> client;
    private final ResponseCache<T> cache;
    private final QuotaSynchronizer synchronizer;
    private final Fingerprinter fingerprinter;
    private final QuotaClock clock;
    private final QuotaWindow quotaWindow;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong liveCalls = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    /**
     * 생성자 (재동기화 없음).
     *
     * @param config 설정
     * @param client API 클라이언트
     * @param cache 응답 캐시
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultApiManager(ApiManagerConfig config, ApiClient<T> client, ResponseCache<T> cache) {
        this(config, client, cache, new NoOpQuotaSynchronizer());
    }

    /**
     * 생성자 (재동기화 전략 지정).
     *
     * @param config 설정
     * @param client API 클라이언트
     * @param cache 응답 캐시
     * @param synchronizer quota 재동기화 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultApiManager(
        ApiManagerConfig config,
        ApiClient<T> client,
        ResponseCache<T> cache,
        QuotaSynchronizer synchronizer
    ) {
        this(config, client, cache, synchronizer, null, SystemQuotaClock.instance());
    }

    /**
     * 생성자 (전체 커스터마이징).
     *
     * @param config 설정
     * @param client API 클라이언트
     * @param cache 응답 캐시
     * @param synchronizer quota 재동기화 전략
     * @param fingerprinter Fingerprinter (null이면 설정의 includedHeaders로 CanonicalFingerprinter 생성)
     * @param clock 시간 소스
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public DefaultApiManager(
        ApiManagerConfig config,
        ApiClient<T> client,
        ResponseCache<T> cache,
        QuotaSynchronizer synchronizer,
        Fingerprinter fingerprinter,
        QuotaClock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (synchronizer == null) {
            throw new IllegalArgumentException("synchronizer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.client = client;
        this.cache = cache;
        this.synchronizer = synchronizer;
        this.fingerprinter = fingerprinter != null
            ? fingerprinter
            : new CanonicalFingerprinter(config.includedHeaders());
        this.clock = clock;
        this.quotaWindow = new QuotaWindow(config.toQuotaConfig(), clock);

        if (config.resyncOnStartup()) {
            resync();
        }
    }

    @Override
    public T request(ApiRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        RequestTrace trace = new RequestTrace(request);
        try {
            // 1. 재동기화 (선택)
            if (config.resyncBeforeRequest()) {
                resync();
            }

            // 2. 캐시 조회
            trace.moveTo(RequestState.CHECK_CACHE);
            String key = resolveKey(request);
            Optional<T> cached = readCache(key);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                trace.moveTo(RequestState.RETURN);
                return cached.get();
            }

            // 3. quota 승인 + 슬롯 예약
            trace.moveTo(RequestState.CHECK_QUOTA);
            QuotaPermit permit = quotaWindow.tryAcquire()
                .orElseThrow(this::rateLimitExceeded);

            // 4. 라이브 호출
            trace.moveTo(RequestState.CALL);
            T response = call(request, key, permit);

            // 5. 캐시 저장 + quota 기록
            trace.moveTo(RequestState.UPDATE);
            try {
                T cacheable = client.processResponseForCache(response);
                if (cacheable != null) {
                    writeCache(key, cacheable);
                }
            } finally {
                permit.record();
            }

            trace.moveTo(RequestState.RETURN);
            return response;

        } catch (RateLimitExceededException e) {
            rateLimited.incrementAndGet();
            trace.fail(e);
            throw e;
        } catch (Throwable e) {
            failures.incrementAndGet();
            trace.fail(e);
            throw e;
        }
    }

    @Override
    public void resync() {
        int before = quotaWindow.getCount();
        synchronizer.synchronize(quotaWindow);
        log.debug("Quota resynchronized: count {} → {}", before, quotaWindow.getCount());
    }

    @Override
    public QuotaSnapshot quota() {
        return quotaWindow.snapshot();
    }

    @Override
    public RequestStats stats() {
        return new RequestStats(cacheHits.get(), liveCalls.get(), rateLimited.get(), failures.get());
    }

    /**
     * quota window 조회 (재동기화 전략 및 테스트용).
     *
     * @return QuotaWindow
     */
    public QuotaWindow quotaWindow() {
        return quotaWindow;
    }

    public ApiManagerConfig getConfig() {
        return config;
    }

    private String resolveKey(ApiRequest request) {
        if (request.hasCacheKey()) {
            return request.cacheKey();
        }
        return fingerprinter.fingerprint(request).getValue();
    }

    /**
     * 라이브 호출.
     *
     * <p>실패 시 quota를 기록하고, 설정된 경우 실패 값을 캐시한 뒤 원래 예외를 그대로 던집니다.
     * Error 등 RuntimeException이 아닌 실패도 시도된 호출이므로 quota는 기록됩니다.</p>
     */
    private T call(ApiRequest request, String key, QuotaPermit permit) {
        liveCalls.incrementAndGet();
        boolean succeeded = false;
        try {
            T response = client.request(request);
            succeeded = true;
            return response;
        } catch (RuntimeException e) {
            permit.record();
            if (e instanceof RemoteRateLimitException) {
                quotaWindow.exhaust();
                log.warn("Remote service reported rate limit reached for {} {}; window exhausted",
                    request.method(), request.endpoint());
            }
            if (config.cacheOnFailure()) {
                cacheFailedResponse(key, e);
            }
            throw e;
        } finally {
            if (!succeeded) {
                permit.record();
            }
        }
    }

    private void cacheFailedResponse(String key, RuntimeException failure) {
        try {
            T cacheable = client.processResponseForCache(null);
            if (cacheable != null) {
                writeCache(key, cacheable);
            }
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private Optional<T> readCache(String key) {
        Optional<T> cached;
        try {
            cached = cache.get(key);
        } catch (CacheFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheFailureException("Cache read failed for key " + key, e);
        }
        return cached == null ? Optional.empty() : cached;
    }

    private void writeCache(String key, T value) {
        try {
            cache.put(key, value);
        } catch (CacheFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheFailureException("Cache write failed for key " + key, e);
        }
    }

    private RateLimitExceededException rateLimitExceeded() {
        QuotaSnapshot snapshot = quotaWindow.snapshot();
        return new RateLimitExceededException(snapshot, snapshot.remainingTime(clock.now()));
    }

    /**
     * 요청 1건의 상태 추적.
     */
    private static final class RequestTrace {

        private final ApiRequest request;
        private RequestState state = RequestState.CHECK_RESYNC;

        private RequestTrace(ApiRequest request) {
            this.request = request;
        }

        private void moveTo(RequestState next) {
            RequestState previous = state;
            state = StateTransition.transition(state, next);
            log.debug("{} {}: {} → {}", request.method(), request.endpoint(), previous, next);
        }

        private void fail(Throwable cause) {
            if (state.isTerminal()) {
                return;
            }
            RequestState previous = state;
            state = StateTransition.transition(state, RequestState.FAILED);
            if (cause instanceof RateLimitExceededException) {
                log.warn("{} {} rejected at {}: {}", request.method(), request.endpoint(), previous, cause.getMessage());
            } else {
                log.debug("{} {} failed at {}: {}", request.method(), request.endpoint(), previous, cause.toString());
            }
        }
    }
}
