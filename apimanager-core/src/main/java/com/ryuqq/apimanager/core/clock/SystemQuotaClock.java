package com.ryuqq.apimanager.core.clock;

import java.time.Instant;

/**
 * 시스템 시계 기반 {@link QuotaClock}.
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class SystemQuotaClock implements QuotaClock {

    private static final SystemQuotaClock INSTANCE = new SystemQuotaClock();

    private SystemQuotaClock() {
    }

    public static SystemQuotaClock instance() {
        return INSTANCE;
    }

    @Override
    public Instant now() {
        return Instant.now();
    }
}
