package cn.bafuka.tierstore.core;

import lombok.Value;

import java.time.Instant;

/**
 * 待写入后端存储的值
 * 同一 id 同时最多存在一个，后写覆盖先写
 *
 * @param <T> 值类型
 */
@Value
public class PendingWrite<T> {

    /**
     * 值的 id
     */
    String key;

    /**
     * 最新的值
     */
    T value;

    /**
     * 入队时间（重试时保持不变）
     */
    Instant enqueuedAt;

    /**
     * 已失败的刷写次数
     */
    int attempts;

    public static <T> PendingWrite<T> of(String key, T value) {
        return new PendingWrite<>(key, value, Instant.now(), 0);
    }

    /**
     * 刷写失败后生成重试条目
     */
    public PendingWrite<T> retry() {
        return new PendingWrite<>(key, value, enqueuedAt, attempts + 1);
    }
}
