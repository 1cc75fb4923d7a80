package cn.bafuka.tierstore.store.impl;

import cn.bafuka.tierstore.codec.ValueCodec;
import cn.bafuka.tierstore.core.BulkErrorCollector;
import cn.bafuka.tierstore.core.BulkErrorHandling;
import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStats;
import cn.bafuka.tierstore.core.CacheStrategy;
import cn.bafuka.tierstore.core.Keyer;
import cn.bafuka.tierstore.core.LoadResult;
import cn.bafuka.tierstore.core.PendingWrite;
import cn.bafuka.tierstore.exception.TierStoreException;
import cn.bafuka.tierstore.fastcache.FastCache;
import cn.bafuka.tierstore.store.CollectionStore;
import cn.bafuka.tierstore.store.TierFailureListener;
import cn.bafuka.tierstore.store.TieredStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 分层缓存存储默认实现
 * <p>
 * 读路径：快速缓存 → （未命中）后端存储 → 回填快速缓存<br>
 * 写路径：总是尽力写快速缓存；WRITE_THROUGH / READ_THROUGH 同步落库，
 * WRITE_BEHIND 写入待写队列，由 {@link WriteBehindFlusher} 周期性刷入后端存储
 * <p>
 * 快速缓存只是加速层：读写失败只记录日志并通知 {@link TierFailureListener}，从不抛给调用方
 *
 * @param <T> 值类型
 */
@Slf4j
public class DefaultTieredStore<T> implements TieredStore<T> {

    private final CollectionStore<T> backingStore;

    /**
     * 快速缓存，为 null 时跳过缓存层
     */
    private final FastCache fastCache;

    private final String collection;

    private final Keyer<T> keyer;

    private final ValueCodec<T> codec;

    private final CacheOptions options;

    private final TierFailureListener failureListener;

    /**
     * 待写队列：id → 最新待写条目，由 queueLock 保护
     */
    private Map<String, PendingWrite<T>> pending = new LinkedHashMap<>();

    /**
     * 正在刷写的 id，由 queueLock 保护；remove 会取消其失败重试
     */
    private final Set<String> inFlight = new HashSet<>();

    private final ReentrantLock queueLock = new ReentrantLock();

    /**
     * 串行化刷新，store / remove 从不持有
     */
    private final ReentrantLock flushLock = new ReentrantLock();

    private final WriteBehindFlusher flusher;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();
    private final AtomicLong cacheFailureCount = new AtomicLong();
    private final AtomicLong flushedCount = new AtomicLong();
    private final AtomicLong flushFailureCount = new AtomicLong();

    public DefaultTieredStore(CollectionStore<T> backingStore,
                              FastCache fastCache,
                              String collection,
                              Keyer<T> keyer,
                              ValueCodec<T> codec,
                              CacheOptions options) {
        this(backingStore, fastCache, collection, keyer, codec, options, TierFailureListener.NONE);
    }

    public DefaultTieredStore(CollectionStore<T> backingStore,
                              FastCache fastCache,
                              String collection,
                              Keyer<T> keyer,
                              ValueCodec<T> codec,
                              CacheOptions options,
                              TierFailureListener failureListener) {
        this.backingStore = Objects.requireNonNull(backingStore, "backingStore must not be null");
        this.keyer = Objects.requireNonNull(keyer, "keyer must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        if (collection == null || collection.trim().isEmpty()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
        if (collection.contains(":")) {
            throw new IllegalArgumentException("collection name must not contain ':': " + collection);
        }
        options.validate();

        this.fastCache = fastCache;
        this.collection = collection;
        this.failureListener = failureListener == null ? TierFailureListener.NONE : failureListener;

        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            this.flusher = new WriteBehindFlusher(collection, options.getWriteBehindInterval(),
                    () -> flushPending(true), () -> flushPending(false));
            this.flusher.start();
        } else {
            this.flusher = null;
        }

        log.info("分层存储已创建: collection={}, strategy={}, ttl={}, fastCache={}",
                collection, options.getStrategy(), options.getTtl(),
                fastCache == null ? "none" : fastCache.getClass().getSimpleName());
    }

    // ==================== 读 ====================

    @Override
    public T load(String id) {
        ensureOpen();
        String key = cacheKey(id);

        T cached = readCache(key);
        if (cached != null) {
            hitCount.incrementAndGet();
            log.debug("快速缓存命中: collection={}, id={}", collection, id);
            return cached;
        }
        missCount.incrementAndGet();

        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            // 未刷写的数据只存在于快速缓存，不能回源读取可能过期的后端数据
            log.debug("快速缓存未命中（WRITE_BEHIND）: collection={}, id={}", collection, id);
            throw TierStoreException.notFound(collection, id);
        }

        log.debug("快速缓存未命中，回源后端存储: collection={}, id={}", collection, id);
        T value = backingStore.load(id);
        if (value == null) {
            throw TierStoreException.notFound(collection, id);
        }
        writeCache(key, value);
        return value;
    }

    @Override
    public Stream<LoadResult<T>> bulkLoad(Iterable<String> ids) {
        ensureOpen();
        return StreamSupport.stream(ids.spliterator(), false)
                .map(id -> {
                    try {
                        return LoadResult.success(id, load(id));
                    } catch (RuntimeException e) {
                        return LoadResult.<T>failure(id, e);
                    }
                });
    }

    @Override
    public Stream<Map.Entry<String, T>> all() {
        ensureOpen();
        return backingStore.all();
    }

    @Override
    public Stream<T> find(Predicate<? super T> where) {
        ensureOpen();
        return backingStore.find(where);
    }

    // ==================== 写 ====================

    @Override
    public T store(T value) {
        ensureOpen();
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        String id = keyer.idOf(value);
        writeCache(cacheKey(id), value);

        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            enqueue(id, value);
            return value;
        }
        return backingStore.store(value);
    }

    @Override
    public void bulkStore(Iterable<? extends T> values, BulkErrorHandling errorHandling) {
        ensureOpen();
        BulkErrorCollector errors = new BulkErrorCollector(errorHandling);

        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            for (T value : values) {
                try {
                    store(value);
                } catch (RuntimeException e) {
                    errors.record(e);
                }
            }
            errors.throwIfAny();
            return;
        }

        List<T> batch = new ArrayList<>();
        for (T value : values) {
            try {
                writeCache(cacheKey(keyer.idOf(value)), value);
                batch.add(value);
            } catch (RuntimeException e) {
                errors.record(e);
            }
        }
        backingStore.bulkStore(batch, errorHandling);
        errors.throwIfAny();
    }

    @Override
    public void remove(String id) {
        ensureOpen();
        deleteCache(cacheKey(id));
        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            dequeue(id);
        }
        backingStore.remove(id);
    }

    @Override
    public void bulkRemove(Iterable<String> ids, BulkErrorHandling errorHandling) {
        ensureOpen();
        List<String> idList = new ArrayList<>();
        ids.forEach(idList::add);
        if (idList.isEmpty()) {
            return;
        }

        String[] keys = idList.stream().map(this::cacheKey).toArray(String[]::new);
        deleteCache(keys);
        if (options.getStrategy() == CacheStrategy.WRITE_BEHIND) {
            idList.forEach(this::dequeue);
        }
        backingStore.bulkRemove(idList, errorHandling);
    }

    // ==================== 写回队列 ====================

    private void enqueue(String id, T value) {
        queueLock.lock();
        try {
            pending.put(id, PendingWrite.of(id, value));
        } finally {
            queueLock.unlock();
        }
    }

    private void dequeue(String id) {
        queueLock.lock();
        try {
            pending.remove(id);
            inFlight.remove(id);
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public int flush() {
        ensureOpen();
        if (options.getStrategy() != CacheStrategy.WRITE_BEHIND) {
            return 0;
        }
        return flushPending(true);
    }

    /**
     * 取出当前待写队列并逐条写入后端存储
     *
     * @param requeue 失败是否重新入队；最终清空时为 false，失败条目记录日志后丢弃
     * @return 成功写入的条目数
     */
    int flushPending(boolean requeue) {
        flushLock.lock();
        try {
            Map<String, PendingWrite<T>> snapshot;
            queueLock.lock();
            try {
                if (pending.isEmpty()) {
                    return 0;
                }
                snapshot = pending;
                pending = new LinkedHashMap<>();
                inFlight.addAll(snapshot.keySet());
            } finally {
                queueLock.unlock();
            }

            int flushed = 0;
            for (PendingWrite<T> write : snapshot.values()) {
                try {
                    backingStore.store(write.getValue());
                    flushed++;
                    flushedCount.incrementAndGet();
                    markDone(write.getKey());
                } catch (RuntimeException e) {
                    flushFailureCount.incrementAndGet();
                    handleFlushFailure(write, e, requeue);
                }
            }

            log.debug("写回刷新完成: collection={}, total={}, flushed={}", collection, snapshot.size(), flushed);
            return flushed;
        } finally {
            flushLock.unlock();
        }
    }

    private void markDone(String id) {
        queueLock.lock();
        try {
            inFlight.remove(id);
        } finally {
            queueLock.unlock();
        }
    }

    private void handleFlushFailure(PendingWrite<T> write, RuntimeException error, boolean requeue) {
        boolean cancelled;
        boolean requeued = false;
        queueLock.lock();
        try {
            cancelled = !inFlight.remove(write.getKey());
            if (!cancelled && requeue) {
                // 刷写期间有更新的写入时保留新值
                requeued = pending.putIfAbsent(write.getKey(), write.retry()) == null;
            }
        } finally {
            queueLock.unlock();
        }

        if (cancelled) {
            log.warn("写回失败，条目已被删除，不再重试: collection={}, id={}", collection, write.getKey(), error);
        } else if (!requeue) {
            log.error("最终刷新失败，丢弃待写条目: collection={}, id={}, attempts={}",
                    collection, write.getKey(), write.getAttempts() + 1, error);
        } else if (requeued) {
            log.error("写回失败，下次刷新重试: collection={}, id={}, attempts={}",
                    collection, write.getKey(), write.getAttempts() + 1, error);
        } else {
            log.warn("写回失败，已有更新的待写值: collection={}, id={}", collection, write.getKey(), error);
        }

        try {
            failureListener.onFlushFailure(collection, write, error);
        } catch (RuntimeException e) {
            log.warn("TierFailureListener.onFlushFailure 异常: collection={}", collection, e);
        }
    }

    @Override
    public int pendingWriteCount() {
        queueLock.lock();
        try {
            return pending.size();
        } finally {
            queueLock.unlock();
        }
    }

    // ==================== 快速缓存 ====================

    String cacheKey(String id) {
        return options.getKeyPrefix() + collection + ":" + id;
    }

    private T readCache(String key) {
        if (fastCache == null) {
            return null;
        }
        String text;
        try {
            text = fastCache.get(key);
        } catch (RuntimeException e) {
            cacheFailure("get", key, e);
            return null;
        }
        if (text == null) {
            return null;
        }
        try {
            return codec.decode(text);
        } catch (RuntimeException e) {
            // 反序列化失败按未命中处理
            cacheFailure("decode", key, e);
            return null;
        }
    }

    private void writeCache(String key, T value) {
        if (fastCache == null) {
            return;
        }
        String text;
        try {
            text = codec.encode(value);
        } catch (RuntimeException e) {
            cacheFailure("encode", key, e);
            return;
        }
        try {
            fastCache.set(key, text, options.getTtl());
        } catch (RuntimeException e) {
            cacheFailure("set", key, e);
        }
    }

    private void deleteCache(String... keys) {
        if (fastCache == null) {
            return;
        }
        try {
            fastCache.delete(keys);
        } catch (RuntimeException e) {
            cacheFailure("delete", String.join(",", keys), e);
        }
    }

    private void cacheFailure(String operation, String key, RuntimeException error) {
        cacheFailureCount.incrementAndGet();
        log.warn("快速缓存{}失败，降级处理: collection={}, key={}, error={}", operation, collection, key, error.toString());
        try {
            failureListener.onCacheTierFailure(collection, operation, key, error);
        } catch (RuntimeException e) {
            log.warn("TierFailureListener.onCacheTierFailure 异常: collection={}", collection, e);
        }
    }

    // ==================== 生命周期 ====================

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            log.warn("分层存储已关闭，忽略重复关闭: collection={}", collection);
            return;
        }
        log.info("关闭分层存储: collection={}", collection);
        if (flusher != null) {
            flusher.stop();
        }
        if (fastCache != null) {
            fastCache.close();
        }
        log.info("分层存储已关闭: collection={}", collection);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("tiered store is closed: " + collection);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 写回调度器状态，非 WRITE_BEHIND 策略返回 null
     */
    public WriteBehindFlusher.FlusherState getFlusherState() {
        return flusher == null ? null : flusher.getState();
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.builder()
                .hitCount(hitCount.get())
                .missCount(missCount.get())
                .cacheFailureCount(cacheFailureCount.get())
                .flushedCount(flushedCount.get())
                .flushFailureCount(flushFailureCount.get())
                .pendingWrites(pendingWriteCount())
                .build();
    }

    @Override
    public String getCollection() {
        return collection;
    }

    @Override
    public CacheOptions getOptions() {
        return options;
    }
}
