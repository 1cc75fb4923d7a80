package cn.bafuka.tierstore.store;

import cn.bafuka.tierstore.core.PendingWrite;

/**
 * 降级路径观察钩子
 * 缓存层故障和写回失败不会抛给调用方，但会通知该监听器（用于打点、告警）
 */
public interface TierFailureListener {

    /**
     * 不做任何处理的监听器
     */
    TierFailureListener NONE = new TierFailureListener() {
    };

    /**
     * 快速缓存读写失败
     *
     * @param collection 集合名称
     * @param operation  操作名称（get / set / delete / encode / decode）
     * @param cacheKey   缓存键
     * @param error      异常
     */
    default void onCacheTierFailure(String collection, String operation, String cacheKey, Exception error) {
    }

    /**
     * 写回刷新时后端存储写入失败
     *
     * @param collection 集合名称
     * @param write      失败的待写条目
     * @param error      异常
     */
    default void onFlushFailure(String collection, PendingWrite<?> write, Exception error) {
    }
}
