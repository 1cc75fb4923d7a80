package cn.bafuka.tierstore.autoconfigure;

import cn.bafuka.tierstore.codec.ValueCodec;
import cn.bafuka.tierstore.codec.ValueCodecFactory;
import cn.bafuka.tierstore.codec.impl.FastJsonValueCodec;
import cn.bafuka.tierstore.config.TierStoreProperties;
import cn.bafuka.tierstore.fastcache.FastCache;
import cn.bafuka.tierstore.fastcache.impl.CaffeineFastCache;
import cn.bafuka.tierstore.fastcache.impl.RedisTemplateFastCache;
import cn.bafuka.tierstore.fastcache.impl.RedissonFastCache;
import cn.bafuka.tierstore.manager.TieredStoreManager;
import cn.bafuka.tierstore.manager.impl.DefaultTieredStoreManager;
import cn.bafuka.tierstore.store.TierFailureListener;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * TierStore 自动配置类
 */
@Slf4j
@Configuration
@AutoConfigureAfter(name = {
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
        "org.redisson.spring.starter.RedissonAutoConfiguration"
})
@EnableConfigurationProperties(TierStoreProperties.class)
@ConditionalOnProperty(prefix = "tierstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TierStoreAutoConfiguration {

    public TierStoreAutoConfiguration() {
        log.info("TierStore auto-configuration initializing...");
    }

    /**
     * 快速缓存
     * 生命周期由 TieredStoreManager 管理，不注册销毁方法
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public FastCache tierStoreFastCache(TierStoreProperties properties,
                                        ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                        ObjectProvider<RedissonClient> redissonClientProvider) {
        TierStoreProperties.FastCacheType type = properties.getFastCache();
        switch (type) {
            case REDIS:
                return redisFastCache(redisTemplateProvider.getIfAvailable());
            case REDISSON:
                return redissonFastCache(redissonClientProvider.getIfAvailable());
            case CAFFEINE:
                return caffeineFastCache(properties);
            case AUTO:
            default:
                StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
                if (redisTemplate != null) {
                    return redisFastCache(redisTemplate);
                }
                RedissonClient redissonClient = redissonClientProvider.getIfAvailable();
                if (redissonClient != null) {
                    return redissonFastCache(redissonClient);
                }
                return caffeineFastCache(properties);
        }
    }

    private FastCache redisFastCache(StringRedisTemplate redisTemplate) {
        if (redisTemplate == null) {
            throw new IllegalStateException("tierstore.fast-cache=redis requires a StringRedisTemplate bean");
        }
        log.info("快速缓存后端: Redis (StringRedisTemplate)");
        return new RedisTemplateFastCache(redisTemplate);
    }

    private FastCache redissonFastCache(RedissonClient redissonClient) {
        if (redissonClient == null) {
            throw new IllegalStateException("tierstore.fast-cache=redisson requires a RedissonClient bean");
        }
        log.info("快速缓存后端: Redisson");
        // RedissonClient 由容器管理，关闭缓存时不关闭客户端
        return new RedissonFastCache(redissonClient, false);
    }

    private FastCache caffeineFastCache(TierStoreProperties properties) {
        long capacity = properties.defaultOptions().getCapacity();
        log.info("快速缓存后端: Caffeine, maximumSize={}", capacity);
        return new CaffeineFastCache(capacity);
    }

    /**
     * 值编解码器工厂，默认 fastjson
     */
    @Bean
    @ConditionalOnMissingBean
    public ValueCodecFactory valueCodecFactory() {
        return new ValueCodecFactory() {
            @Override
            public <T> ValueCodec<T> forType(Class<T> type) {
                return new FastJsonValueCodec<>(type);
            }
        };
    }

    /**
     * 分层存储管理器
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(TieredStoreManager.class)
    public DefaultTieredStoreManager tieredStoreManager(TierStoreProperties properties,
                                                        FastCache fastCache,
                                                        ValueCodecFactory valueCodecFactory,
                                                        ObjectProvider<TierFailureListener> failureListenerProvider) {
        return new DefaultTieredStoreManager(
                fastCache,
                properties.defaultOptions(),
                properties.collectionOptions(),
                valueCodecFactory,
                failureListenerProvider.getIfAvailable(() -> TierFailureListener.NONE));
    }
}
