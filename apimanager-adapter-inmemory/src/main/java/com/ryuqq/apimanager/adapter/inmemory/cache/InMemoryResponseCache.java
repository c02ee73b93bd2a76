package com.ryuqq.apimanager.adapter.inmemory.cache;

import com.ryuqq.apimanager.core.spi.ResponseCache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ResponseCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p><strong>Characteristics:</strong></p>
 * <ul>
 *   <li>Unbounded: entries are never evicted</li>
 *   <li>Thread-safe: O(1) get/put without manual locking</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p>Suitable for short-lived processes and tests. Use {@link LruResponseCache} when the number of
 * distinct requests is unbounded.</p>
 *
 * @param <T> cached value type
 * @author API Manager Team
 * @since 1.0.0
 */
public class InMemoryResponseCache<T> implements ResponseCache<T> {

    /**
     * Fingerprint → cached response.
     */
    private final ConcurrentHashMap<String, T> entries;

    /**
     * Creates a new InMemoryResponseCache with empty storage.
     */
    public InMemoryResponseCache() {
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<T> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, T value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.put(key, value);
    }

    /**
     * Removes a cached entry.
     *
     * @param key the request fingerprint
     * @return true if an entry was removed
     */
    public boolean invalidate(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return entries.remove(key) != null;
    }

    /**
     * Clears all cached entries.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the number of cached entries.
     *
     * @return the number of entries
     */
    public int size() {
        return entries.size();
    }
}
