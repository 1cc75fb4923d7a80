package cn.bafuka.tierstore.fastcache;

import java.time.Duration;

/**
 * 快速缓存接口
 * 低延迟的键值存储，支持按键过期；容量淘汰由具体实现负责
 * <p>
 * 任何方法抛出的 RuntimeException 都视为缓存层故障，由调用方降级处理
 */
public interface FastCache {

    /**
     * 读取序列化值
     *
     * @param key 缓存键
     * @return 序列化值，不存在返回 null
     */
    String get(String key);

    /**
     * 写入序列化值
     *
     * @param key   缓存键
     * @param value 序列化值
     * @param ttl   存活时间
     */
    void set(String key, String value, Duration ttl);

    /**
     * 删除一个或多个键
     *
     * @param keys 缓存键
     */
    void delete(String... keys);

    /**
     * 关闭连接/释放资源，关闭后不可再使用
     */
    void close();
}
