package com.ryuqq.apimanager.application.manager;

import com.ryuqq.apimanager.core.quota.QuotaConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ApiManagerConfig 테스트.
 *
 * @author API Manager Team
 * @since 1.0.0
 */
class ApiManagerConfigTest {

    @Test
    void of_기본값_적용() {
        // when
        ApiManagerConfig config = ApiManagerConfig.of(Duration.ofMinutes(1), 60);

        // then
        assertThat(config.windowBuffer()).isEqualTo(Duration.ZERO);
        assertThat(config.resyncBeforeRequest()).isFalse();
        assertThat(config.resyncOnStartup()).isFalse();
        assertThat(config.cacheOnFailure()).isFalse();
        assertThat(config.includedHeaders()).isEmpty();
    }

    @Test
    void toQuotaConfig_window_설정_전달() {
        // given
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofHours(1))
            .threshold(5000)
            .windowBuffer(Duration.ofSeconds(1))
            .build();

        // when
        QuotaConfig quota = config.toQuotaConfig();

        // then
        assertThat(quota).isEqualTo(new QuotaConfig(Duration.ofHours(1), 5000, Duration.ofSeconds(1)));
    }

    @Test
    void builder_threshold_누락시_예외() {
        assertThatThrownBy(() -> ApiManagerConfig.builder().windowDuration(Duration.ofMinutes(1)).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threshold must be positive");
    }

    @Test
    void builder_windowDuration_누락시_예외() {
        assertThatThrownBy(() -> ApiManagerConfig.builder().threshold(10).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("windowDuration cannot be null");
    }

    @Test
    void includedHeaders_방어적_복사() {
        // given
        Set<String> headers = new HashSet<>(Set.of("Accept"));
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofMinutes(1))
            .threshold(1)
            .includedHeaders(headers)
            .build();

        // when
        headers.add("Authorization");

        // then
        assertThat(config.includedHeaders()).containsExactly("Accept");
    }

    @Test
    void withX_나머지_값_유지() {
        // given
        ApiManagerConfig original = ApiManagerConfig.of(Duration.ofMinutes(1), 10);

        // when
        ApiManagerConfig updated = original.withCacheOnFailure(true).withResyncBeforeRequest(true);

        // then
        assertThat(updated.cacheOnFailure()).isTrue();
        assertThat(updated.resyncBeforeRequest()).isTrue();
        assertThat(updated.threshold()).isEqualTo(10);
        assertThat(original.cacheOnFailure()).isFalse();
    }

    @Test
    void builder_음수_windowBuffer는_예외() {
        assertThatThrownBy(() -> ApiManagerConfig.builder()
            .windowDuration(Duration.ofMinutes(1))
            .threshold(10)
            .windowBuffer(Duration.ofSeconds(-1))
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("windowBuffer must be zero or positive");
    }

    @Test
    void builder_windowBuffer_null이면_0으로_대체() {
        ApiManagerConfig config = ApiManagerConfig.builder()
            .windowDuration(Duration.ofMinutes(1))
            .threshold(10)
            .windowBuffer(null)
            .build();

        assertThat(config.windowBuffer()).isEqualTo(Duration.ZERO);
    }
}
