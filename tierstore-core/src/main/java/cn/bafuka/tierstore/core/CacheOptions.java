package cn.bafuka.tierstore.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 分层存储配置
 * 构造后不可变
 */
@Value
@Builder(toBuilder = true)
public class CacheOptions {

    /**
     * 快速缓存中条目的存活时间
     */
    @Builder.Default
    Duration ttl = Duration.ofHours(1);

    /**
     * 建议的最大条目数（由快速缓存后端负责淘汰，本组件不做淘汰）
     */
    @Builder.Default
    long capacity = 10000;

    /**
     * 缓存策略
     */
    @Builder.Default
    CacheStrategy strategy = CacheStrategy.READ_THROUGH;

    /**
     * 写回刷新间隔，仅 WRITE_BEHIND 有效
     */
    @Builder.Default
    Duration writeBehindInterval = Duration.ofSeconds(5);

    /**
     * 缓存键全局前缀，最终键为 {@code <prefix><collection>:<id>}
     */
    @Builder.Default
    String keyPrefix = "";

    /**
     * 默认配置：ttl=1h, capacity=10000, strategy=READ_THROUGH, writeBehindInterval=5s
     */
    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }

    /**
     * 校验配置，非法时抛出 IllegalArgumentException
     */
    public void validate() {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (strategy == CacheStrategy.WRITE_BEHIND
                && (writeBehindInterval == null || writeBehindInterval.isNegative() || writeBehindInterval.isZero())) {
            throw new IllegalArgumentException("writeBehindInterval must be positive: " + writeBehindInterval);
        }
        if (keyPrefix == null) {
            throw new IllegalArgumentException("keyPrefix must not be null");
        }
    }
}
