package cn.bafuka.tierstore.store.impl;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 写回刷新调度器
 * 单线程按固定间隔执行刷新任务；停止时等待当前刷新完成，再在调用线程上执行最终清空
 */
@Slf4j
public class WriteBehindFlusher {

    /**
     * 停止时等待刷新线程结束的超时时间
     */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    public enum FlusherState {
        NEW,
        RUNNING,
        DRAINING,
        STOPPED
    }

    private final String collection;

    private final Duration interval;

    /**
     * 每个周期执行的刷新
     */
    private final Runnable flushTask;

    /**
     * 停止时执行的最终清空
     */
    private final Runnable drainTask;

    private final AtomicReference<FlusherState> state = new AtomicReference<>(FlusherState.NEW);

    private ScheduledExecutorService scheduler;

    public WriteBehindFlusher(String collection, Duration interval, Runnable flushTask, Runnable drainTask) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("flush interval must be positive: " + interval);
        }
        this.collection = collection;
        this.interval = interval;
        this.flushTask = flushTask;
        this.drainTask = drainTask;
    }

    /**
     * 启动后台刷新，只能调用一次
     */
    public void start() {
        if (!state.compareAndSet(FlusherState.NEW, FlusherState.RUNNING)) {
            throw new IllegalStateException("flusher already started: " + collection);
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tierstore-flush-" + collection);
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("写回刷新已启动: collection={}, interval={}", collection, interval);
    }

    private void tick() {
        try {
            flushTask.run();
        } catch (RuntimeException e) {
            // 周期任务抛出异常会取消后续调度
            log.error("写回刷新异常: collection={}", collection, e);
        }
    }

    /**
     * 停止后台刷新并执行最终清空，重复调用无效果
     */
    public void stop() {
        if (state.compareAndSet(FlusherState.NEW, FlusherState.DRAINING)) {
            runDrain();
            return;
        }
        if (!state.compareAndSet(FlusherState.RUNNING, FlusherState.DRAINING)) {
            return;
        }

        try {
            scheduler.shutdown();
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("写回刷新线程未在 {} 秒内结束，强制关闭: collection={}", SHUTDOWN_TIMEOUT_SECONDS, collection);
                List<Runnable> dropped = scheduler.shutdownNow();
                if (!dropped.isEmpty()) {
                    log.warn("丢弃了 {} 个未执行的刷新任务", dropped.size());
                }
            }
        } catch (InterruptedException e) {
            log.error("等待写回刷新线程结束被中断: collection={}", collection, e);
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        runDrain();
    }

    private void runDrain() {
        try {
            drainTask.run();
        } finally {
            state.set(FlusherState.STOPPED);
            log.info("写回刷新已停止: collection={}", collection);
        }
    }

    public FlusherState getState() {
        return state.get();
    }

    public String getCollection() {
        return collection;
    }
}
