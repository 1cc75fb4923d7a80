package cn.bafuka.tierstore.store;

import cn.bafuka.tierstore.core.BulkErrorHandling;
import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStats;
import cn.bafuka.tierstore.core.LoadResult;

import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 分层缓存存储
 * 位于快速缓存与后端存储之间，按配置的 {@link cn.bafuka.tierstore.core.CacheStrategy} 协调两层读写
 * <p>
 * 关闭后不可再使用
 *
 * @param <T> 值类型
 */
public interface TieredStore<T> extends AutoCloseable {

    /**
     * 按 id 加载
     * 先查快速缓存；未命中时 READ_THROUGH / WRITE_THROUGH 回源后端存储并回填缓存，
     * WRITE_BEHIND 直接视为不存在
     *
     * @param id 数据 id
     * @return 值
     * @throws cn.bafuka.tierstore.exception.TierStoreException 数据不存在（WRITE_BEHIND 缓存未命中）
     */
    T load(String id);

    /**
     * 写入
     * 总是尽力写入快速缓存；同步策略同步落库，WRITE_BEHIND 入队后立即返回
     *
     * @param value 值
     * @return 存储后的值
     */
    T store(T value);

    /**
     * 删除：快速缓存、待写队列、后端存储
     *
     * @param id 数据 id
     */
    void remove(String id);

    /**
     * 批量写入
     *
     * @param values        值序列
     * @param errorHandling 错误处理策略
     */
    void bulkStore(Iterable<? extends T> values, BulkErrorHandling errorHandling);

    /**
     * 批量删除
     *
     * @param ids           id 序列
     * @param errorHandling 错误处理策略
     */
    void bulkRemove(Iterable<String> ids, BulkErrorHandling errorHandling);

    /**
     * 批量加载，按输入顺序惰性地逐个调用 {@link #load(String)}
     * 消费方停止拉取后不再加载
     *
     * @param ids id 序列
     * @return 每个 id 的加载结果
     */
    Stream<LoadResult<T>> bulkLoad(Iterable<String> ids);

    /**
     * 全量扫描，总是直接走后端存储
     */
    Stream<Map.Entry<String, T>> all();

    /**
     * 条件查询，总是直接走后端存储
     */
    Stream<T> find(Predicate<? super T> where);

    /**
     * 立即执行一次写回刷新（仅 WRITE_BEHIND 有效）
     *
     * @return 本次成功写入后端存储的条目数
     */
    int flush();

    /**
     * 当前待写条目数
     */
    int pendingWriteCount();

    CacheStats getStats();

    String getCollection();

    CacheOptions getOptions();

    /**
     * 停止后台刷新任务（先执行一次最终刷新），然后关闭快速缓存
     */
    @Override
    void close();
}
