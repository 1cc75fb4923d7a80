package cn.bafuka.tierstore.codec;

import cn.bafuka.tierstore.codec.impl.FastJsonValueCodec;
import cn.bafuka.tierstore.exception.TierStoreException;
import cn.bafuka.tierstore.support.Product;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * FastJsonValueCodec 单元测试
 */
public class FastJsonValueCodecTest {

    private final FastJsonValueCodec<Product> codec = new FastJsonValueCodec<>(Product.class);

    @Test
    public void testEncodeDecode() {
        String text = codec.encode(new Product("p1", "apple", 5));

        assertTrue(text.contains("\"name\":\"apple\""));
        assertEquals(new Product("p1", "apple", 5), codec.decode(text));
    }

    /**
     * 测试空内容解码为 null
     */
    @Test
    public void testDecodeEmpty() {
        assertNull(codec.decode(null));
        assertNull(codec.decode(""));
    }

    /**
     * 测试损坏数据抛出序列化异常
     */
    @Test
    public void testDecodeCorrupt() {
        try {
            codec.decode("{\"id\":\"p1\",\"name\":");
            fail("expected TierStoreException");
        } catch (TierStoreException e) {
            assertEquals(TierStoreException.Reason.SERIALIZATION_ERROR, e.getReason());
            assertNotNull(e.getCause());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullTypeRejected() {
        new FastJsonValueCodec<>(null);
    }
}
