package cn.bafuka.tierstore.codec;

/**
 * 按类型创建 {@link ValueCodec}
 */
@FunctionalInterface
public interface ValueCodecFactory {

    <T> ValueCodec<T> forType(Class<T> type);
}
