package cn.bafuka.tierstore.codec;

/**
 * 值编解码器
 * 只用于快速缓存层；后端存储始终收到原始对象，不经过编解码
 *
 * @param <T> 值类型
 */
public interface ValueCodec<T> {

    /**
     * 序列化
     *
     * @param value 值
     * @return 序列化后的字符串
     */
    String encode(T value);

    /**
     * 反序列化
     *
     * @param text 序列化字符串
     * @return 值，内容为空时返回 null
     */
    T decode(String text);
}
