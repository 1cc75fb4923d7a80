package cn.bafuka.tierstore.autoconfigure;

import cn.bafuka.tierstore.codec.ValueCodecFactory;
import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStrategy;
import cn.bafuka.tierstore.fastcache.FastCache;
import cn.bafuka.tierstore.fastcache.impl.CaffeineFastCache;
import cn.bafuka.tierstore.fastcache.impl.RedisTemplateFastCache;
import cn.bafuka.tierstore.fastcache.impl.RedissonFastCache;
import cn.bafuka.tierstore.manager.TieredStoreManager;
import cn.bafuka.tierstore.store.TieredStore;
import cn.bafuka.tierstore.store.impl.InMemoryCollectionStore;
import cn.bafuka.tierstore.support.Product;
import org.junit.Test;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * TierStoreAutoConfiguration 单元测试
 */
public class TierStoreAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TierStoreAutoConfiguration.class));

    /**
     * 测试没有 Redis 时使用 Caffeine 和默认配置
     */
    @Test
    public void testDefaultsWithoutRedis() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TieredStoreManager.class);
            assertThat(context).hasSingleBean(ValueCodecFactory.class);
            assertThat(context.getBean(FastCache.class)).isInstanceOf(CaffeineFastCache.class);

            CacheOptions options = context.getBean(TieredStoreManager.class).resolveOptions("products");
            assertThat(options.getStrategy()).isEqualTo(CacheStrategy.READ_THROUGH);
            assertThat(options.getTtl()).isEqualTo(Duration.ofHours(1));
            assertThat(options.getCapacity()).isEqualTo(10000L);
        });
    }

    /**
     * 测试全局默认和按集合覆盖的配置绑定
     */
    @Test
    public void testPropertiesBinding() {
        contextRunner
                .withPropertyValues(
                        "tierstore.key-prefix=shop:",
                        "tierstore.defaults.ttl=10m",
                        "tierstore.defaults.strategy=write-through",
                        "tierstore.collections.orders.strategy=write-behind",
                        "tierstore.collections.orders.write-behind-interval=200ms")
                .run(context -> {
                    TieredStoreManager manager = context.getBean(TieredStoreManager.class);

                    CacheOptions products = manager.resolveOptions("products");
                    assertThat(products.getStrategy()).isEqualTo(CacheStrategy.WRITE_THROUGH);
                    assertThat(products.getTtl()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(products.getKeyPrefix()).isEqualTo("shop:");

                    CacheOptions orders = manager.resolveOptions("orders");
                    assertThat(orders.getStrategy()).isEqualTo(CacheStrategy.WRITE_BEHIND);
                    assertThat(orders.getWriteBehindInterval()).isEqualTo(Duration.ofMillis(200));
                    assertThat(orders.getTtl()).isEqualTo(Duration.ofMinutes(10));
                });
    }

    /**
     * 测试存在 StringRedisTemplate 时自动选择 Redis
     */
    @Test
    public void testAutoPrefersRedisTemplate() {
        contextRunner
                .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
                .withBean(RedissonClient.class, () -> mock(RedissonClient.class))
                .run(context -> assertThat(context.getBean(FastCache.class)).isInstanceOf(RedisTemplateFastCache.class));
    }

    @Test
    public void testAutoFallsBackToRedisson() {
        contextRunner
                .withBean(RedissonClient.class, () -> mock(RedissonClient.class))
                .run(context -> assertThat(context.getBean(FastCache.class)).isInstanceOf(RedissonFastCache.class));
    }

    @Test
    public void testExplicitCaffeine() {
        contextRunner
                .withPropertyValues("tierstore.fast-cache=caffeine")
                .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
                .run(context -> assertThat(context.getBean(FastCache.class)).isInstanceOf(CaffeineFastCache.class));
    }

    /**
     * 测试显式指定 redis 但没有 StringRedisTemplate 时启动失败
     */
    @Test
    public void testRedisWithoutTemplateFails() {
        contextRunner
                .withPropertyValues("tierstore.fast-cache=redis")
                .run(context -> assertThat(context).hasFailed());
    }

    /**
     * 测试非法配置启动失败
     */
    @Test
    public void testInvalidOptionsFail() {
        contextRunner
                .withPropertyValues("tierstore.defaults.capacity=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    public void testDisabled() {
        contextRunner
                .withPropertyValues("tierstore.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(TieredStoreManager.class));
    }

    /**
     * 测试容器关闭时清空写回队列
     */
    @Test
    public void testContextCloseDrainsWriteBehindStores() {
        InMemoryCollectionStore<Product> backing = new InMemoryCollectionStore<>("orders", Product::getId);
        contextRunner
                .withPropertyValues(
                        "tierstore.collections.orders.strategy=write-behind",
                        "tierstore.collections.orders.write-behind-interval=1h")
                .run(context -> {
                    TieredStore<Product> orders = context.getBean(TieredStoreManager.class)
                            .createStore("orders", backing, Product::getId, Product.class);
                    orders.store(new Product("o1", "order", 10));
                    assertThat(backing.contains("o1")).isFalse();
                });

        assertThat(backing.contains("o1")).isTrue();
    }
}
