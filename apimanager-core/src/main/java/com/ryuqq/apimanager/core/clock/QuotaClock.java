package com.ryuqq.apimanager.core.clock;

import java.time.Instant;

/**
 * Quota window가 사용하는 시간 소스.
 *
 * <p>운영 환경에서는 {@link SystemQuotaClock}을, 테스트에서는 수동으로 시간을 진행시키는 구현을 사용합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QuotaClock {

    /**
     * 현재 시각.
     *
     * @return 현재 시각 (null 불가)
     */
    Instant now();
}
