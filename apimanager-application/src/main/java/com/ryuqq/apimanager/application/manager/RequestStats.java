package com.ryuqq.apimanager.application.manager;

/**
 * 누적 요청 통계.
 *
 * @param cacheHits 캐시 적중 수
 * @param liveCalls 라이브 호출 수 (성공 + 실패)
 * @param rateLimited 로컬 quota 거부 수
 * @param failures 실패 수 (rate limit 거부 제외)
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public record RequestStats(long cacheHits, long liveCalls, long rateLimited, long failures) {

    /**
     * 전체 요청 수 (캐시 적중 + 라이브 호출 + 거부).
     *
     * @return 전체 요청 수
     */
    public long totalRequests() {
        return cacheHits + liveCalls + rateLimited;
    }

    /**
     * 캐시 적중률.
     *
     * @return 0.0 ~ 1.0, 요청이 없으면 0.0
     */
    public double hitRatio() {
        long total = cacheHits + liveCalls;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }
}
