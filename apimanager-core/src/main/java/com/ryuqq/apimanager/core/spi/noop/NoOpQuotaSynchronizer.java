package com.ryuqq.apimanager.core.spi.noop;

import com.ryuqq.apimanager.core.quota.QuotaWindow;
import com.ryuqq.apimanager.core.spi.QuotaSynchronizer;

/**
 * Quota Synchronizer NoOp 구현.
 *
 * <p>아무 것도 하지 않습니다. 단일 프로세스에서 원격 quota 신호 없이 로컬 count만으로
 * 충분한 경우 사용합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class NoOpQuotaSynchronizer implements QuotaSynchronizer {

    @Override
    public void synchronize(QuotaWindow window) {
        // no-op
    }
}
