package cn.bafuka.tierstore.fastcache.impl;

import cn.bafuka.tierstore.fastcache.FastCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * 进程内快速缓存实现
 * 基于 Caffeine，按条目独立过期，容量上限由 maximumSize 控制
 */
@Slf4j
public class CaffeineFastCache implements FastCache {

    /**
     * Caffeine 缓存实例
     * Key: 缓存键
     * Value: 序列化值 + 写入时的 TTL
     */
    private final Cache<String, TimedValue> cache;

    /**
     * 是否已关闭
     */
    private volatile boolean closed = false;

    public CaffeineFastCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new TtlExpiry())
                .recordStats()
                .build();

        log.info("构建 Caffeine 快速缓存，配置: maximumSize={}", maximumSize);
    }

    @Override
    public String get(String key) {
        ensureOpen();
        TimedValue timed = cache.getIfPresent(key);
        if (timed == null) {
            log.debug("Caffeine 缓存未命中: key={}", key);
            return null;
        }
        log.debug("Caffeine 缓存命中: key={}", key);
        return timed.value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ensureOpen();
        if (key == null || value == null || ttl == null) {
            return;
        }
        cache.put(key, new TimedValue(value, ttl.toNanos()));
        log.debug("Caffeine 缓存写入: key={}, ttl={}", key, ttl);
    }

    @Override
    public void delete(String... keys) {
        ensureOpen();
        if (keys == null || keys.length == 0) {
            return;
        }
        cache.invalidateAll(Arrays.asList(keys));
        log.debug("Caffeine 缓存删除: keys={}", Arrays.toString(keys));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cache.invalidateAll();
        cache.cleanUp();
        log.info("Caffeine 快速缓存已关闭");
    }

    /**
     * 查询键的剩余存活时间
     *
     * @param key 缓存键
     * @return 剩余时间，键不存在时为空
     */
    public Optional<Duration> remainingTtl(String key) {
        return cache.policy().expireVariably()
                .map(expiration -> expiration.getExpiresAfter(key, TimeUnit.NANOSECONDS))
                .filter(OptionalLong::isPresent)
                .map(nanos -> Duration.ofNanos(nanos.getAsLong()));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    /**
     * 触发 Caffeine 的异步维护（淘汰、过期清理）
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    /**
     * 获取命中率等统计信息
     */
    public String getStats() {
        CacheStats stats = cache.stats();
        return String.format(
                "Caffeine FastCache Stats: hitRate=%.2f%%, hitCount=%d, missCount=%d, evictionCount=%d",
                stats.hitRate() * 100,
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount()
        );
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CaffeineFastCache is closed");
        }
    }

    /**
     * 序列化值与其 TTL
     */
    private static final class TimedValue {
        private final String value;
        private final long ttlNanos;

        private TimedValue(String value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    /**
     * 写入和覆盖时按条目自身的 TTL 重新计时，读取不影响过期时间
     */
    private static final class TtlExpiry implements Expiry<String, TimedValue> {

        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
