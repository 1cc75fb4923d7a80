package cn.bafuka.tierstore.core;

/**
 * 从值中提取唯一标识
 * 必须是纯函数：同一个值总是返回同一个 id
 *
 * @param <T> 值类型
 */
@FunctionalInterface
public interface Keyer<T> {

    /**
     * 提取 id
     *
     * @param value 存储的值
     * @return 唯一标识，不能为空
     */
    String idOf(T value);
}
