package com.ryuqq.apimanager.core.spi;

import com.ryuqq.apimanager.core.quota.QuotaWindow;

/**
 * Quota Synchronizer SPI.
 *
 * <p>Refreshes the local quota window from an authoritative external signal, typically a
 * "requests remaining" endpoint of the remote service, by calling
 * {@link QuotaWindow#setCount(int)}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * QuotaSynchronizer synchronizer = window -> {
 *     RateLimitStatus status = statusClient.fetch();
 *     window.setCount(status.limit() - status.remaining());
 * };
 * }</pre>
 *
 * <p><strong>Limitations:</strong> cross-process consistency is best-effort. There is no
 * distributed lock, so two processes can still race between a resync and their own admitted call.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QuotaSynchronizer {

    /**
     * Aligns the window with the remote service's view of the quota.
     *
     * @param window the local quota window
     * @throws RuntimeException if the authoritative signal could not be obtained
     */
    void synchronize(QuotaWindow window);
}
