/**
 * In-memory {@link com.ryuqq.apimanager.core.spi.ResponseCache} implementations.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.apimanager.adapter.inmemory.cache.InMemoryResponseCache} - Unbounded, ConcurrentHashMap based</li>
 *   <li>{@link com.ryuqq.apimanager.adapter.inmemory.cache.LruResponseCache} - Bounded, least-recently-used eviction</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across processes</li>
 *   <li>No time-based expiry</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ResponseCache&lt;String&gt; cache = new LruResponseCache&lt;&gt;(10_000);
 * ApiManager&lt;String&gt; manager = new DefaultApiManager&lt;&gt;(config, client, cache);
 * </pre>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.adapter.inmemory.cache;
