package com.ryuqq.apimanager.application.manager;

import com.ryuqq.apimanager.core.quota.QuotaConfig;

import java.time.Duration;
import java.util.Set;

/**
 * API Manager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>windowDuration: quota window 길이 (필수)</li>
 *   <li>threshold: window 당 최대 호출 수 (필수)</li>
 *   <li>windowBuffer: window 여유 시간 (기본 0)</li>
 *   <li>resyncBeforeRequest: 매 요청 전 재동기화 (기본 false)</li>
 *   <li>resyncOnStartup: 생성 시 1회 재동기화 (기본 false)</li>
 *   <li>cacheOnFailure: 클라이언트 실패 시 실패 값 캐시 (기본 false)</li>
 *   <li>includedHeaders: Fingerprint에 포함할 헤더 (기본 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ApiManagerConfig config = ApiManagerConfig.builder()
 *     .windowDuration(Duration.ofHours(1))
 *     .threshold(5000)
 *     .resyncBeforeRequest(true)
 *     .build();
 * }</pre>
 *
 * @param windowDuration quota window 길이
 * @param threshold window 당 최대 호출 수
 * @param windowBuffer window 여유 시간
 * @param resyncBeforeRequest 매 요청 전 재동기화 여부
 * @param resyncOnStartup 생성 시 재동기화 여부
 * @param cacheOnFailure 실패 값 캐시 여부
 * @param includedHeaders Fingerprint에 포함할 헤더 이름
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public record ApiManagerConfig(
    Duration windowDuration,
    int threshold,
    Duration windowBuffer,
    boolean resyncBeforeRequest,
    boolean resyncOnStartup,
    boolean cacheOnFailure,
    Set<String> includedHeaders
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ApiManagerConfig {
        if (windowDuration == null) {
            throw new IllegalArgumentException("windowDuration cannot be null");
        }
        if (windowBuffer == null) {
            windowBuffer = Duration.ZERO;
        }
        includedHeaders = includedHeaders == null ? Set.of() : Set.copyOf(includedHeaders);
        // window 길이/threshold 검증은 QuotaConfig에 위임
        QuotaConfig.validate(windowDuration, threshold, windowBuffer);
    }

    /**
     * 필수 항목만으로 생성 (나머지는 기본값).
     *
     * @param windowDuration quota window 길이
     * @param threshold window 당 최대 호출 수
     * @return ApiManagerConfig
     */
    public static ApiManagerConfig of(Duration windowDuration, int threshold) {
        return builder().windowDuration(windowDuration).threshold(threshold).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * QuotaWindow 설정으로 변환.
     *
     * @return QuotaConfig
     */
    public QuotaConfig toQuotaConfig() {
        return new QuotaConfig(windowDuration, threshold, windowBuffer);
    }

    /**
     * resyncBeforeRequest만 변경한 새 인스턴스 생성.
     *
     * @param resyncBeforeRequest 새 값
     * @return 새 ApiManagerConfig 인스턴스
     */
    public ApiManagerConfig withResyncBeforeRequest(boolean resyncBeforeRequest) {
        return new ApiManagerConfig(windowDuration, threshold, windowBuffer,
            resyncBeforeRequest, resyncOnStartup, cacheOnFailure, includedHeaders);
    }

    /**
     * cacheOnFailure만 변경한 새 인스턴스 생성.
     *
     * @param cacheOnFailure 새 값
     * @return 새 ApiManagerConfig 인스턴스
     */
    public ApiManagerConfig withCacheOnFailure(boolean cacheOnFailure) {
        return new ApiManagerConfig(windowDuration, threshold, windowBuffer,
            resyncBeforeRequest, resyncOnStartup, cacheOnFailure, includedHeaders);
    }

    /**
     * ApiManagerConfig Builder.
     */
    public static final class Builder {

        private Duration windowDuration;
        private int threshold;
        private Duration windowBuffer = Duration.ZERO;
        private boolean resyncBeforeRequest;
        private boolean resyncOnStartup;
        private boolean cacheOnFailure;
        private Set<String> includedHeaders = Set.of();

        private Builder() {
        }

        public Builder windowDuration(Duration windowDuration) {
            this.windowDuration = windowDuration;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder windowBuffer(Duration windowBuffer) {
            this.windowBuffer = windowBuffer;
            return this;
        }

        public Builder resyncBeforeRequest(boolean resyncBeforeRequest) {
            this.resyncBeforeRequest = resyncBeforeRequest;
            return this;
        }

        public Builder resyncOnStartup(boolean resyncOnStartup) {
            this.resyncOnStartup = resyncOnStartup;
            return this;
        }

        public Builder cacheOnFailure(boolean cacheOnFailure) {
            this.cacheOnFailure = cacheOnFailure;
            return this;
        }

        public Builder includedHeaders(Set<String> includedHeaders) {
            this.includedHeaders = includedHeaders;
            return this;
        }

        public ApiManagerConfig build() {
            return new ApiManagerConfig(windowDuration, threshold, windowBuffer,
                resyncBeforeRequest, resyncOnStartup, cacheOnFailure, includedHeaders);
        }
    }
}
