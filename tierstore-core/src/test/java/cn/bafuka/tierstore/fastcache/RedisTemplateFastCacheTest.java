package cn.bafuka.tierstore.fastcache;

import cn.bafuka.tierstore.fastcache.impl.RedisTemplateFastCache;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * RedisTemplateFastCache 单元测试
 */
public class RedisTemplateFastCacheTest {

    private RedisTemplateFastCache fastCache;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        fastCache = new RedisTemplateFastCache(redisTemplate);

        // 默认 mock valueOperations
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    public void testGet() {
        when(valueOperations.get("products:1")).thenReturn("{\"id\":\"1\"}");

        assertEquals("{\"id\":\"1\"}", fastCache.get("products:1"));
        assertNull(fastCache.get("products:2"));
    }

    /**
     * 测试写入时按毫秒设置过期时间
     */
    @Test
    public void testSetWithTtl() {
        fastCache.set("products:1", "value", Duration.ofSeconds(90));

        verify(valueOperations).set("products:1", "value", 90000L, TimeUnit.MILLISECONDS);
    }

    /**
     * 测试批量删除只发一次命令
     */
    @Test
    public void testDeleteMultipleKeys() {
        fastCache.delete("products:1", "products:2");

        verify(redisTemplate, times(1)).delete(Arrays.asList("products:1", "products:2"));
    }

    @Test
    public void testDeleteNothing() {
        fastCache.delete();

        verifyNoInteractions(redisTemplate);
    }

    /**
     * 测试 Redis 异常直接抛出，由分层存储降级处理
     */
    @Test(expected = IllegalStateException.class)
    public void testErrorsPropagate() {
        when(valueOperations.get(anyString())).thenThrow(new IllegalStateException("connection refused"));

        fastCache.get("products:1");
    }

    /**
     * 测试关闭不影响 Spring 管理的连接
     */
    @Test
    public void testCloseLeavesTemplateAlone() {
        fastCache.close();

        verifyNoInteractions(redisTemplate);
    }
}
