package cn.bafuka.tierstore.store;

import cn.bafuka.tierstore.core.BulkErrorHandling;

import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 持久化集合存储（后端存储）
 * 以 id 为键的权威数据源，如文档数据库中的一个集合
 *
 * @param <T> 值类型
 */
public interface CollectionStore<T> {

    /**
     * 按 id 加载
     *
     * @param id 数据 id
     * @return 值
     * @throws RuntimeException 数据不存在或存储故障
     */
    T load(String id);

    /**
     * 写入（按 id 覆盖）
     *
     * @param value 值
     * @return 存储后的值
     */
    T store(T value);

    /**
     * 按 id 删除
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
     * 全量扫描
     *
     * @return 惰性的 (id, 值) 序列
     */
    Stream<Map.Entry<String, T>> all();

    /**
     * 条件查询，默认在全量扫描上过滤
     *
     * @param where 过滤条件
     * @return 惰性的值序列
     */
    default Stream<T> find(Predicate<? super T> where) {
        return all().map(Map.Entry::getValue).filter(where);
    }
}
