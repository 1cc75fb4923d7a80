package cn.bafuka.tierstore.config;

import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TierStore 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "tierstore")
public class TierStoreProperties {

    /**
     * 是否启用 TierStore
     */
    private boolean enabled = true;

    /**
     * 缓存键全局前缀
     */
    private String keyPrefix = "";

    /**
     * 快速缓存后端
     */
    private FastCacheType fastCache = FastCacheType.AUTO;

    /**
     * 全局默认配置
     */
    private OptionsProperties defaults = new OptionsProperties();

    /**
     * 按集合覆盖的配置，未设置的字段沿用全局默认
     */
    private Map<String, OptionsProperties> collections = new LinkedHashMap<>();

    /**
     * 全局默认配置
     */
    public CacheOptions defaultOptions() {
        CacheOptions base = CacheOptions.defaults().toBuilder()
                .keyPrefix(keyPrefix == null ? "" : keyPrefix)
                .build();
        return defaults == null ? base : defaults.applyTo(base);
    }

    /**
     * 各集合的完整配置（全局默认 + 覆盖）
     */
    public Map<String, CacheOptions> collectionOptions() {
        CacheOptions base = defaultOptions();
        Map<String, CacheOptions> result = new LinkedHashMap<>();
        collections.forEach((name, overrides) -> result.put(name, overrides.applyTo(base)));
        return result;
    }

    public enum FastCacheType {
        /**
         * 优先 StringRedisTemplate，其次 RedissonClient，都不存在时使用 Caffeine
         */
        AUTO,
        CAFFEINE,
        REDIS,
        REDISSON
    }

    @Data
    public static class OptionsProperties {

        private Duration ttl;

        private Long capacity;

        private CacheStrategy strategy;

        private Duration writeBehindInterval;

        CacheOptions applyTo(CacheOptions base) {
            CacheOptions.CacheOptionsBuilder builder = base.toBuilder();
            if (ttl != null) {
                builder.ttl(ttl);
            }
            if (capacity != null) {
                builder.capacity(capacity);
            }
            if (strategy != null) {
                builder.strategy(strategy);
            }
            if (writeBehindInterval != null) {
                builder.writeBehindInterval(writeBehindInterval);
            }
            return builder.build();
        }
    }
}
