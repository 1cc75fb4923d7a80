package cn.bafuka.tierstore.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分层存储统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hitCount;
    private long missCount;

    /**
     * 快速缓存读写失败次数（已降级处理）
     */
    private long cacheFailureCount;

    /**
     * 成功刷入后端存储的写回条目数
     */
    private long flushedCount;
    private long flushFailureCount;
    private int pendingWrites;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double hitRate() {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 1.0 : (double) hitCount / requestCount;
    }
}
