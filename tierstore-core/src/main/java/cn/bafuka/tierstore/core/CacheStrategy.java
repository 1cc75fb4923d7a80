package cn.bafuka.tierstore.core;

/**
 * 缓存策略
 * 构造时确定，运行期间不可变更
 */
public enum CacheStrategy {

    /**
     * 同步写穿：写缓存的同时同步写入后端存储，调用方直接感知后端存储的成败
     */
    WRITE_THROUGH,

    /**
     * 异步写回：只写缓存和待写队列，由后台任务周期性刷入后端存储
     * 未刷写的数据在进程崩溃时会丢失
     */
    WRITE_BEHIND,

    /**
     * 读穿：缓存未命中时回源后端存储并回填缓存，写操作同步落库
     */
    READ_THROUGH
}
