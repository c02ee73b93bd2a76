package com.ryuqq.apimanager.adapter.runner;

import com.ryuqq.apimanager.application.manager.ApiManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 주기적 quota 재동기화 스케줄러.
 *
 * <p>요청마다 재동기화하는 대신, 고정 주기로 {@link ApiManager#resync()}를 호출하여
 * 외부(다른 프로세스, 원격 서비스)의 quota 상태를 로컬 window에 반영합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>daemon 스레드 1개로 fixed-delay 실행</li>
 *   <li>개별 재동기화 실패는 로깅 후 다음 주기에 계속 진행</li>
 *   <li>{@link #close()} 시 스케줄 종료</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class QuotaResyncScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QuotaResyncScheduler.class);

    private final ApiManager<?> manager;
    private final ResyncConfig config;
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private ScheduledExecutorService executor;

    /**
     * 생성자.
     *
     * @param manager 재동기화 대상
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QuotaResyncScheduler(ApiManager<?> manager, ResyncConfig config) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.manager = manager;
        this.config = config;
    }

    /**
     * 스케줄 시작. 이미 실행 중이면 무시.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.warn("QuotaResyncScheduler already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "quota-resync");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(
            this::runOnce,
            config.initialDelayMs(),
            config.intervalMs(),
            TimeUnit.MILLISECONDS
        );
        log.info("QuotaResyncScheduler started: interval {} ms", config.intervalMs());
    }

    /**
     * 스케줄 종료. 진행 중인 재동기화는 최대 5초까지 기다립니다.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("QuotaResyncScheduler stopped: {} succeeded, {} failed", successes.get(), failures.get());
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * 재동기화 1회 수행.
     *
     * <p>예외가 발생해도 스케줄이 중단되지 않도록 로깅 후 false를 반환합니다.</p>
     *
     * @return 성공 여부
     */
    public boolean runOnce() {
        try {
            manager.resync();
            successes.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("Quota resynchronization failed", e);
            return false;
        }
    }

    public long getSuccessCount() {
        return successes.get();
    }

    public long getFailureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        stop();
    }
}
