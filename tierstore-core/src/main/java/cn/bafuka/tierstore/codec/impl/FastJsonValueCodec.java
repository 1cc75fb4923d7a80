package cn.bafuka.tierstore.codec.impl;

import cn.bafuka.tierstore.codec.ValueCodec;
import cn.bafuka.tierstore.exception.TierStoreException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;

/**
 * 基于 fastjson 的 JSON 编解码器
 *
 * @param <T> 值类型
 */
public class FastJsonValueCodec<T> implements ValueCodec<T> {

    private final Class<T> type;

    public FastJsonValueCodec(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        this.type = type;
    }

    @Override
    public String encode(T value) {
        try {
            return JSON.toJSONString(value);
        } catch (JSONException e) {
            throw new TierStoreException("Failed to encode " + type.getSimpleName(), e,
                    null, null, TierStoreException.Reason.SERIALIZATION_ERROR);
        }
    }

    @Override
    public T decode(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return JSON.parseObject(text, type);
        } catch (JSONException e) {
            throw new TierStoreException("Failed to decode " + type.getSimpleName(), e,
                    null, null, TierStoreException.Reason.SERIALIZATION_ERROR);
        }
    }

    public Class<T> getType() {
        return type;
    }
}
