package com.ryuqq.apimanager.core.spi;

import com.ryuqq.apimanager.core.model.ApiRequest;

/**
 * API Client SPI.
 *
 * <p>Performs live calls against the remote API. The transport (HTTP library, retries inside a
 * single call, timeouts) and the response shape belong entirely to the implementation.</p>
 *
 * <p><strong>Failure Contract:</strong></p>
 * <ul>
 *   <li>Non-success outcomes (as defined by the implementation, e.g. non-2xx status) must be thrown</li>
 *   <li>{@link com.ryuqq.apimanager.core.exception.TransportFailureException} is preferred;
 *       any other runtime exception is propagated to the caller unchanged</li>
 *   <li>Throw {@link com.ryuqq.apimanager.core.exception.RemoteRateLimitException} when the remote
 *       service reports that its own limit was reached</li>
 *   <li>Timeouts are reported as failures; the orchestrator has no timeout logic of its own</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: a single client is shared by all concurrent requests of one manager</li>
 * </ul>
 *
 * @param <T> raw response type, also the type stored in the cache
 * @author API Manager Team
 * @since 1.0.0
 */
public interface ApiClient<T> {

    /**
     * Performs a live call.
     *
     * @param request the logical request (method, endpoint, headers, params, body)
     * @return the raw response
     * @throws RuntimeException if the call failed
     */
    T request(ApiRequest request);

    /**
     * Derives the value to store in the cache for a response.
     *
     * <p>Called with the response after a successful call, and with {@code null} after a failed call
     * when caching of failures is enabled.</p>
     *
     * @param response the response, or {@code null} for a failed call
     * @return the cacheable value, or {@code null} to skip caching
     */
    T processResponseForCache(T response);
}
