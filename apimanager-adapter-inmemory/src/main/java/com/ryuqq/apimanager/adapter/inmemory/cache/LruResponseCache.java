package com.ryuqq.apimanager.adapter.inmemory.cache;

import com.ryuqq.apimanager.core.spi.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory {@link ResponseCache} with least-recently-used eviction.
 *
 * <p><strong>Design:</strong></p>
 * <ul>
 *   <li>{@link LinkedHashMap} with {@code accessOrder=true}: both get and put refresh recency</li>
 *   <li>The eldest entry is evicted when size exceeds maxSize</li>
 *   <li>All operations are synchronized on the instance</li>
 * </ul>
 *
 * @param <T> cached value type
 * @author API Manager Team
 * @since 1.0.0
 */
public class LruResponseCache<T> implements ResponseCache<T> {

    private static final Logger log = LoggerFactory.getLogger(LruResponseCache.class);

    private final int maxSize;
    private final LinkedHashMap<String, T> entries;
    private long evictions;

    /**
     * Creates an LRU cache.
     *
     * @param maxSize maximum number of entries (must be positive)
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public LruResponseCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, T> eldest) {
                boolean evict = size() > LruResponseCache.this.maxSize;
                if (evict) {
                    evictions++;
                    log.debug("Evicted cache entry {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized Optional<T> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, T value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.put(key, value);
    }

    /**
     * Checks whether a key is cached without refreshing its recency.
     *
     * @param key the request fingerprint
     * @return true if cached
     */
    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getEvictions() {
        return evictions;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
