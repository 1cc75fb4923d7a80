package cn.bafuka.tierstore.fastcache.impl;

import cn.bafuka.tierstore.fastcache.FastCache;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Redis 快速缓存实现
 * 基于 Redisson 的 RBucket，值以纯字符串存储
 */
@Slf4j
public class RedissonFastCache implements FastCache {

    /**
     * Redisson 客户端
     */
    private final RedissonClient redissonClient;

    /**
     * 是否由本缓存负责关闭客户端
     */
    private final boolean shutdownClientOnClose;

    public RedissonFastCache(RedissonClient redissonClient, boolean shutdownClientOnClose) {
        if (redissonClient == null) {
            throw new IllegalArgumentException("redissonClient must not be null");
        }
        this.redissonClient = redissonClient;
        this.shutdownClientOnClose = shutdownClientOnClose;
    }

    @Override
    public String get(String key) {
        RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
        String value = bucket.get();
        log.debug("Redisson 读取: key={}, hit={}", key, value != null);
        return value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
        bucket.set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Redisson 写入: key={}, ttl={}ms", key, ttl.toMillis());
    }

    @Override
    public void delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return;
        }
        long deleted = redissonClient.getKeys().delete(keys);
        log.debug("Redisson 删除: keys={}, deleted={}", Arrays.toString(keys), deleted);
    }

    @Override
    public void close() {
        if (!shutdownClientOnClose) {
            log.info("RedissonFastCache 关闭（客户端由外部管理，不做处理）");
            return;
        }
        if (!redissonClient.isShutdown()) {
            redissonClient.shutdown();
            log.info("RedissonFastCache 已关闭 Redisson 客户端");
        }
    }
}
