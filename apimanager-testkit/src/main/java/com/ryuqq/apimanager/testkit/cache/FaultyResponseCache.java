package com.ryuqq.apimanager.testkit.cache;

import com.ryuqq.apimanager.core.spi.ResponseCache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 장애 주입이 가능한 참조 {@link ResponseCache} 구현.
 *
 * <p>정상 상태에서는 ConcurrentHashMap 기반 캐시로 동작하며,
 * {@link #failOnGet(boolean)}, {@link #failOnPut(boolean)}로 저장소 장애를 재현합니다.</p>
 *
 * @param <T> 값 타입
 * @author API Manager Team
 * @since 1.0.0
 */
public class FaultyResponseCache<T> implements ResponseCache<T> {

    private final ConcurrentHashMap<String, T> entries = new ConcurrentHashMap<>();
    private final AtomicInteger gets = new AtomicInteger();
    private final AtomicInteger puts = new AtomicInteger();
    private volatile boolean failOnGet;
    private volatile boolean failOnPut;

    @Override
    public Optional<T> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        gets.incrementAndGet();
        if (failOnGet) {
            throw new IllegalStateException("Simulated cache read failure");
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
        puts.incrementAndGet();
        if (failOnPut) {
            throw new IllegalStateException("Simulated cache write failure");
        }
        entries.put(key, value);
    }

    public FaultyResponseCache<T> failOnGet(boolean fail) {
        this.failOnGet = fail;
        return this;
    }

    public FaultyResponseCache<T> failOnPut(boolean fail) {
        this.failOnPut = fail;
        return this;
    }

    public int getCount() {
        return gets.get();
    }

    public int putCount() {
        return puts.get();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }
}
