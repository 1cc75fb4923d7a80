package cn.bafuka.tierstore.fastcache.impl;

import cn.bafuka.tierstore.fastcache.FastCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Redis 快速缓存实现
 * 基于 Spring Data Redis 的 StringRedisTemplate
 * <p>
 * 连接工厂由 Spring 容器管理，close 不会关闭连接
 */
@Slf4j
public class RedisTemplateFastCache implements FastCache {

    /**
     * Redis 模板
     */
    private final StringRedisTemplate redisTemplate;

    public RedisTemplateFastCache(StringRedisTemplate redisTemplate) {
        if (redisTemplate == null) {
            throw new IllegalArgumentException("redisTemplate must not be null");
        }
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        log.debug("Redis 读取: key={}, hit={}", key, value != null);
        return value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Redis 写入: key={}, ttl={}ms", key, ttl.toMillis());
    }

    @Override
    public void delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return;
        }
        Long deleted = redisTemplate.delete(Arrays.asList(keys));
        log.debug("Redis 删除: keys={}, deleted={}", Arrays.toString(keys), deleted);
    }

    @Override
    public void close() {
        log.info("RedisTemplateFastCache 关闭（连接由 Spring 容器管理，不做处理）");
    }
}
