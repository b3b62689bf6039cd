package org.muma.mini.kv.server;

import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定期删除策略
 * 单个后台线程按固定间隔调用 {@link KeyspaceStore#cleanupExpired()}，
 * 惰性删除仍然由 Store 自己在读写路径上完成。
 */
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final KeyspaceStore store;
    private final long intervalMs;

    private ScheduledExecutorService executor;

    public ExpirySweeper(KeyspaceStore store, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("cleanup interval must be positive: " + intervalMs);
        }
        this.store = store;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(ThreadUtils.namedThreadFactory("kv-active-expire"));
        executor.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Expiry sweeper started, interval {} ms", intervalMs);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        ThreadUtils.shutdownGracefully(executor, 1000);
        executor = null;
        log.info("Expiry sweeper stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    void sweep() {
        try {
            int removed = store.cleanupExpired();
            if (removed > 0) {
                log.debug("Active expire removed {} keys", removed);
            }
        } catch (RuntimeException e) {
            // 抛出异常会终止后续调度，这里记录后等待下一轮
            log.error("Active expire cycle failed", e);
        }
    }
}
