package cn.bafuka.tierstore.manager;

import cn.bafuka.tierstore.codec.ValueCodec;
import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStats;
import cn.bafuka.tierstore.core.Keyer;
import cn.bafuka.tierstore.store.CollectionStore;
import cn.bafuka.tierstore.store.TieredStore;

import java.util.Map;
import java.util.Set;

/**
 * 分层存储管理器
 * 每个集合一个 {@link TieredStore}，所有存储共享同一个快速缓存
 */
public interface TieredStoreManager {

    /**
     * 使用默认编解码器和该集合的配置（全局默认 + 集合覆盖）创建存储
     *
     * @param collection   集合名称
     * @param backingStore 后端存储
     * @param keyer        id 提取函数
     * @param type         值类型
     * @param <T>          值类型
     * @return 分层存储
     * @throws IllegalStateException 集合已注册
     */
    <T> TieredStore<T> createStore(String collection, CollectionStore<T> backingStore, Keyer<T> keyer, Class<T> type);

    /**
     * 使用指定编解码器和配置创建存储
     */
    <T> TieredStore<T> createStore(String collection, CollectionStore<T> backingStore, Keyer<T> keyer,
                                   ValueCodec<T> codec, CacheOptions options);

    /**
     * 获取已注册的存储
     *
     * @param collection 集合名称
     * @return 分层存储，未注册返回 null
     */
    <T> TieredStore<T> getStore(String collection);

    /**
     * 解析集合的生效配置
     */
    CacheOptions resolveOptions(String collection);

    Set<String> getCollectionNames();

    /**
     * 关闭并注销单个存储（执行最终写回刷新）
     *
     * @param collection 集合名称
     * @return 是否存在该存储
     */
    boolean closeStore(String collection);

    CacheStats getStats(String collection);

    Map<String, CacheStats> getAllStats();

    /**
     * 关闭所有存储，然后关闭共享的快速缓存
     */
    void shutdown();
}
