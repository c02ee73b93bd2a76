package com.ryuqq.apimanager.core.spi;

import java.util.Optional;

/**
 * Response Cache SPI.
 *
 * <p>Key/value storage for cacheable responses. Eviction and expiry are entirely the
 * implementation's responsibility.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>{@code put} overwrites any previous value for the same key</li>
 *   <li>Storage failures may be thrown as
 *       {@link com.ryuqq.apimanager.core.exception.CacheFailureException}; other runtime
 *       exceptions are wrapped into it by the orchestrator</li>
 * </ul>
 *
 * @param <T> cached value type
 * @author API Manager Team
 * @since 1.0.0
 */
public interface ResponseCache<T> {

    /**
     * Looks up a cached value.
     *
     * @param key the request fingerprint
     * @return the cached value, or empty if absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<T> get(String key);

    /**
     * Stores a value, replacing any previous value for the key.
     *
     * @param key the request fingerprint
     * @param value the value to store
     * @throws IllegalArgumentException if key or value is null
     */
    void put(String key, T value);
}
