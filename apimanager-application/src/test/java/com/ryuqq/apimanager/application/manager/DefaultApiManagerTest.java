package com.ryuqq.apimanager.application.manager;

import com.ryuqq.apimanager.adapter.inmemory.cache.InMemoryResponseCache;
import com.ryuqq.apimanager.core.exception.CacheFailureException;
import com.ryuqq.apimanager.core.exception.RateLimitExceededException;
import com.ryuqq.apimanager.core.exception.RemoteRateLimitException;
import com.ryuqq.apimanager.core.exception.TransportFailureException;
import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.model.HttpMethod;
import com.ryuqq.apimanager.core.quota.QuotaWindow;
import com.ryuqq.apimanager.core.spi.QuotaSynchronizer;
import com.ryuqq.apimanager.core.spi.ResponseCache;
import com.ryuqq.apimanager.testkit.cache.FaultyResponseCache;
import com.ryuqq.apimanager.testkit.client.StubApiClient;
import com.ryuqq.apimanager.testkit.clock.ManualQuotaClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * DefaultApiManager 유닛 테스트.
 *
 * <p>요청 오케스트레이션 규칙을 검증합니다:</p>
 * <ul>
 *   <li>캐시 적중은 quota를 소비하지 않음</li>
 *   <li>window 당 최대 threshold 건의 라이브 호출</li>
 *   <li>라이브 호출은 성공/실패와 무관하게 quota 1건 소비</li>
 *   <li>캐시 장애는 CacheFailureException으로 전파</li>
 *   <li>재동기화 시점 (요청 전, 생성 시)</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultApiManagerTest {

    @Mock
    private ResponseCache<String> mockCache;

    @Mock
    private QuotaSynchronizer synchronizer;

    private ManualQuotaClock clock;
    private StubApiClient<String> client;
    private FaultyResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new ManualQuotaClock();
        client = StubApiClient.echo();
        cache = new FaultyResponseCache<>();
    }

    private DefaultApiManager<String> manager(ApiManagerConfig config) {
        return new DefaultApiManager<>(config, client, cache, (QuotaSynchronizer) window -> { }, null, clock);
    }

    private static ApiRequest user(int id) {
        return ApiRequest.get("/v1/users/" + id);
    }

    // ============================================================
    // 1. 캐시 적중
    // ============================================================

    @Test
    void request_동일_요청_60회는_라이브_호출_1회() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofHours(1), 60));
        ApiRequest request = ApiRequest.builder(HttpMethod.GET, "/v1/rate_limit").param("page", 1).build();

        // when
        for (int i = 0; i < 60; i++) {
            assertThat(manager.request(request)).isEqualTo("GET /v1/rate_limit {page=1}");
        }

        // then
        assertThat(client.callCount()).isEqualTo(1);
        assertThat(manager.quota().count()).isEqualTo(1);
        assertThat(manager.stats()).isEqualTo(new RequestStats(59, 1, 0, 0));
        assertThat(manager.stats().hitRatio()).isCloseTo(59.0 / 60, within(1e-9));
    }

    @Test
    void request_파라미터_순서가_달라도_캐시_적중() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        // when
        manager.request(ApiRequest.builder(HttpMethod.GET, "/search").param("q", "java").param("page", 2).build());
        manager.request(ApiRequest.builder(HttpMethod.GET, "/search").param("page", 2).param("q", "java").build());

        // then
        assertThat(client.callCount()).isEqualTo(1);
    }

    @Test
    void request_캐시_적중은_quota가_소진되어도_응답() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 1));
        String first = manager.request(user(1));

        // when
        String second = manager.request(user(1));

        // then
        assertThat(second).isEqualTo(first);
        assertThat(manager.quota().remainingCalls()).isZero();
        assertThat(client.callCount()).isEqualTo(1);
    }

    @Test
    void request_cacheKey_지정시_해당_키로_캐시() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        // when
        String first = manager.request(user(1).withCacheKey("current-user"));
        String second = manager.request(user(2).withCacheKey("current-user"));

        // then
        assertThat(second).isEqualTo(first);
        assertThat(cache.contains("current-user")).isTrue();
        assertThat(client.callCount()).isEqualTo(1);
    }

    @Test
    void request_processResponseForCache가_null이면_캐시하지_않음() {
        // given
        client.cacheMapper(response -> null);
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        // when
        manager.request(user(1));
        manager.request(user(1));

        // then
        assertThat(client.callCount()).isEqualTo(2);
        assertThat(cache.size()).isZero();
        assertThat(manager.quota().count()).isEqualTo(2);
    }

    @Test
    void request_캐시에는_가공된_값이_저장되고_호출자는_원본을_받음() {
        // given
        client.cacheMapper(String::toUpperCase);
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        // when
        String live = manager.request(ApiRequest.get("/v1/items"));
        String cached = manager.request(ApiRequest.get("/v1/items"));

        // then
        assertThat(live).isEqualTo("GET /v1/items {}");
        assertThat(cached).isEqualTo("GET /V1/ITEMS {}");
    }

    // ============================================================
    // 2. quota 제한
    // ============================================================

    @Test
    void request_threshold_초과시_RateLimitExceededException() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofSeconds(60), 2));
        manager.request(user(1));
        clock.advance(Duration.ofSeconds(20));
        manager.request(user(2));

        // when & then
        assertThatThrownBy(() -> manager.request(user(3)))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(40));
                assertThat(e.getQuota().count()).isEqualTo(2);
                assertThat(e.getErrorCode()).isEqualTo("RATE-LIMIT");
            });
        assertThat(client.callCount()).isEqualTo(2);
        assertThat(manager.quota().count()).isEqualTo(2);
        assertThat(manager.stats().rateLimited()).isEqualTo(1);
    }

    @Test
    void request_window_경과후_다시_승인() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofSeconds(60), 2));
        manager.request(user(1));
        manager.request(user(2));
        assertThatThrownBy(() -> manager.request(user(3))).isInstanceOf(RateLimitExceededException.class);

        // when
        clock.advance(Duration.ofSeconds(60));
        manager.request(user(3));

        // then
        assertThat(manager.quota().count()).isEqualTo(1);
        assertThat(client.callCount()).isEqualTo(3);
    }

    @Test
    void request_windowBuffer_만큼_재설정_지연() {
        // given
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofSeconds(60))
            .threshold(1)
            .windowBuffer(Duration.ofSeconds(2))
            .build();
        DefaultApiManager<String> manager = manager(config);
        manager.request(user(1));

        // when
        clock.advance(Duration.ofSeconds(61));

        // then
        assertThatThrownBy(() -> manager.request(user(2))).isInstanceOf(RateLimitExceededException.class);
        clock.advance(Duration.ofSeconds(1));
        assertThat(manager.request(user(2))).isNotNull();
    }

    // ============================================================
    // 3. 클라이언트 실패
    // ============================================================

    @Test
    void request_클라이언트_실패는_quota를_소비하고_캐시하지_않음() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));
        client.failNext(new TransportFailureException("Service Unavailable", 503));

        // when & then
        assertThatThrownBy(() -> manager.request(user(1)))
            .isInstanceOf(TransportFailureException.class)
            .hasMessage("Service Unavailable");
        assertThat(manager.quota().count()).isEqualTo(1);
        assertThat(cache.putCount()).isZero();

        manager.request(user(1));
        assertThat(client.callCount()).isEqualTo(2);
        assertThat(manager.stats().failures()).isEqualTo(1);
    }

    @Test
    void request_cacheOnFailure_설정시_실패값을_캐시() {
        // given
        client.failureCacheValue("unavailable");
        DefaultApiManager<String> manager = manager(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10).withCacheOnFailure(true));
        client.failNext(new IllegalStateException("boom"));

        // when
        assertThatThrownBy(() -> manager.request(user(1))).isInstanceOf(IllegalStateException.class);
        String second = manager.request(user(1));

        // then
        assertThat(second).isEqualTo("unavailable");
        assertThat(client.callCount()).isEqualTo(1);
    }

    @Test
    void request_cacheOnFailure_미설정시_실패값을_캐시하지_않음() {
        // given
        client.failureCacheValue("unavailable");
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));
        client.failNext(new IllegalStateException("boom"));

        // when
        assertThatThrownBy(() -> manager.request(user(1))).isInstanceOf(IllegalStateException.class);

        // then
        assertThat(cache.size()).isZero();
    }

    @Test
    void request_클라이언트가_Error를_던져도_quota와_실패_통계_기록() {
        // given
        StubApiClient<String> failing = new StubApiClient<>(request -> {
            throw new AssertionError("client bug");
        });
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10), failing, cache, synchronizer, null, clock);

        // when & then
        assertThatThrownBy(() -> manager.request(user(1)))
            .isInstanceOf(AssertionError.class)
            .hasMessage("client bug");
        assertThat(manager.quota().count()).isEqualTo(1);
        assertThat(manager.quota().inFlight()).isZero();
        assertThat(manager.stats().failures()).isEqualTo(1);
        assertThat(manager.stats().liveCalls()).isEqualTo(1);
        assertThat(cache.size()).isZero();
    }

    @Test
    void request_원격_rate_limit_응답시_window_소진() {
        // given
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));
        client.failNext(new RemoteRateLimitException("Too Many Requests", 429));

        // when
        assertThatThrownBy(() -> manager.request(user(1))).isInstanceOf(RemoteRateLimitException.class);

        // then
        assertThat(manager.quota().count()).isEqualTo(10);
        assertThatThrownBy(() -> manager.request(user(2))).isInstanceOf(RateLimitExceededException.class);
        assertThat(client.callCount()).isEqualTo(1);
    }

    // ============================================================
    // 4. 캐시 장애
    // ============================================================

    @Test
    void request_캐시_조회_실패시_CacheFailureException_호출_없음() {
        // given
        when(mockCache.get(anyString())).thenThrow(new IllegalStateException("connection refused"));
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10), client, mockCache, synchronizer, null, clock);

        // when & then
        assertThatThrownBy(() -> manager.request(user(1)))
            .isInstanceOf(CacheFailureException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(client.callCount()).isZero();
        assertThat(manager.quota().count()).isZero();
        verify(mockCache, never()).put(anyString(), any());
    }

    @Test
    void request_캐시_저장_실패시_호출은_기록됨() {
        // given
        cache.failOnPut(true);
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        // when & then
        assertThatThrownBy(() -> manager.request(user(1)))
            .isInstanceOf(CacheFailureException.class)
            .hasMessageContaining("Cache write failed");
        assertThat(client.callCount()).isEqualTo(1);
        assertThat(manager.quota().count()).isEqualTo(1);
        assertThat(manager.quota().inFlight()).isZero();
    }

    @Test
    void request_인메모리_캐시와_함께_동작() {
        // given
        InMemoryResponseCache<String> memory = new InMemoryResponseCache<>();
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 5), client, memory);

        // when
        manager.request(HttpMethod.POST, "/v1/search", Map.of(), Map.of("q", "java"), Map.of("limit", 10));
        manager.request(HttpMethod.POST, "/v1/search", null, Map.of("q", "java"), Map.of("limit", 10));

        // then
        assertThat(memory.size()).isEqualTo(1);
        assertThat(client.callCount()).isEqualTo(1);
    }

    // ============================================================
    // 5. 재동기화
    // ============================================================

    @Test
    void request_resyncBeforeRequest_설정시_매_요청마다_재동기화() {
        // given
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10).withResyncBeforeRequest(true),
            client, cache, synchronizer, null, clock);

        // when
        manager.request(user(1));
        manager.request(user(1));
        manager.request(user(2));

        // then
        verify(synchronizer, times(3)).synchronize(manager.quotaWindow());
    }

    @Test
    void request_재동기화된_count가_승인에_반영됨() {
        // given
        doAnswer(invocation -> {
            invocation.<QuotaWindow>getArgument(0).setCount(10);
            return null;
        }).when(synchronizer).synchronize(any(QuotaWindow.class));
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10).withResyncBeforeRequest(true),
            client, cache, synchronizer, null, clock);

        // when & then
        assertThatThrownBy(() -> manager.request(user(1))).isInstanceOf(RateLimitExceededException.class);
        assertThat(client.callCount()).isZero();
    }

    @Test
    void constructor_resyncOnStartup_설정시_생성_시점에_재동기화() {
        // given
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofMinutes(1))
            .threshold(10)
            .resyncOnStartup(true)
            .build();

        // when
        DefaultApiManager<String> manager = new DefaultApiManager<>(config, client, cache, synchronizer, null, clock);

        // then
        verify(synchronizer).synchronize(manager.quotaWindow());
    }

    @Test
    void request_재동기화_기본값은_비활성() {
        // when
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10), client, cache, synchronizer, null, clock);
        manager.request(user(1));

        // then
        verifyNoInteractions(synchronizer);
    }

    @Test
    void resync_동기화_실패는_전파되고_quota는_그대로() {
        // given
        doThrow(new IllegalStateException("remote unavailable")).when(synchronizer).synchronize(any());
        DefaultApiManager<String> manager = new DefaultApiManager<>(
            ApiManagerConfig.of(Duration.ofMinutes(1), 10).withResyncBeforeRequest(true),
            client, cache, synchronizer, null, clock);

        // when & then
        assertThatThrownBy(() -> manager.request(user(1))).isInstanceOf(IllegalStateException.class);
        assertThat(manager.quota().count()).isZero();
        assertThat(client.callCount()).isZero();
    }

    // ============================================================
    // 6. 입력 검증
    // ============================================================

    @Test
    void request_null_요청은_예외() {
        DefaultApiManager<String> manager = manager(ApiManagerConfig.of(Duration.ofMinutes(1), 10));

        assertThatThrownBy(() -> manager.request((ApiRequest) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("request cannot be null");
    }

    @Test
    void constructor_null_의존성은_예외() {
        ApiManagerConfig config = ApiManagerConfig.of(Duration.ofMinutes(1), 10);

        assertThatThrownBy(() -> new DefaultApiManager<>(null, client, cache))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
        assertThatThrownBy(() -> new DefaultApiManager<String>(config, null, cache))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("client");
        assertThatThrownBy(() -> new DefaultApiManager<>(config, client, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cache");
    }

    @Test
    void constructor_포함_헤더는_fingerprint에_반영() {
        // given
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofMinutes(1))
            .threshold(10)
            .includedHeaders(Set.of("Accept-Language"))
            .build();
        DefaultApiManager<String> manager = manager(config);

        // when
        manager.request(ApiRequest.builder(HttpMethod.GET, "/v1/items").header("Accept-Language", "ko").build());
        manager.request(ApiRequest.builder(HttpMethod.GET, "/v1/items").header("Accept-Language", "en").build());

        // then
        assertThat(client.callCount()).isEqualTo(2);
    }
}
