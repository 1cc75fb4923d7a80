package cn.bafuka.tierstore.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 批量加载中单个 id 的结果：要么有值，要么有错误
 *
 * @param <T> 值类型
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoadResult<T> {

    private final String id;

    private final T value;

    private final RuntimeException error;

    public static <T> LoadResult<T> success(String id, T value) {
        return new LoadResult<>(id, value, null);
    }

    public static <T> LoadResult<T> failure(String id, RuntimeException error) {
        return new LoadResult<>(id, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * 成功时返回值，失败时抛出原始异常
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "LoadResult{id=" + id + ", value=" + value + '}'
                : "LoadResult{id=" + id + ", error=" + error + '}';
    }
}
