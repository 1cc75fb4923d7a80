package cn.bafuka.tierstore.core;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * CacheOptions 单元测试
 */
public class CacheOptionsTest {

    @Test
    public void testDefaults() {
        CacheOptions options = CacheOptions.defaults();

        assertEquals(Duration.ofHours(1), options.getTtl());
        assertEquals(10000, options.getCapacity());
        assertEquals(CacheStrategy.READ_THROUGH, options.getStrategy());
        assertEquals(Duration.ofSeconds(5), options.getWriteBehindInterval());
        assertEquals("", options.getKeyPrefix());
        options.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValidate_NonPositiveCapacity() {
        CacheOptions.builder().capacity(0).build().validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValidate_NegativeTtl() {
        CacheOptions.builder().ttl(Duration.ofSeconds(-1)).build().validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValidate_NullStrategy() {
        CacheOptions.builder().strategy(null).build().validate();
    }

    /**
     * 写回间隔只在 WRITE_BEHIND 下校验
     */
    @Test
    public void testValidate_IntervalOnlyCheckedForWriteBehind() {
        CacheOptions.builder().strategy(CacheStrategy.WRITE_THROUGH).writeBehindInterval(Duration.ZERO).build().validate();

        try {
            CacheOptions.builder().strategy(CacheStrategy.WRITE_BEHIND).writeBehindInterval(Duration.ZERO).build().validate();
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("writeBehindInterval"));
        }
    }
}
