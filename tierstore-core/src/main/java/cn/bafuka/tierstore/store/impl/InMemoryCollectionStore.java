package cn.bafuka.tierstore.store.impl;

import cn.bafuka.tierstore.core.BulkErrorCollector;
import cn.bafuka.tierstore.core.BulkErrorHandling;
import cn.bafuka.tierstore.core.Keyer;
import cn.bafuka.tierstore.exception.TierStoreException;
import cn.bafuka.tierstore.store.CollectionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * 基于内存的集合存储
 * 线程安全，可作为后端存储的参考实现或测试替身
 *
 * @param <T> 值类型
 */
@Slf4j
public class InMemoryCollectionStore<T> implements CollectionStore<T> {

    private final String collection;

    private final Keyer<T> keyer;

    private final Map<String, T> data = new ConcurrentHashMap<>();

    public InMemoryCollectionStore(String collection, Keyer<T> keyer) {
        if (keyer == null) {
            throw new IllegalArgumentException("keyer must not be null");
        }
        this.collection = collection;
        this.keyer = keyer;
    }

    @Override
    public T load(String id) {
        T value = id == null ? null : data.get(id);
        if (value == null) {
            throw TierStoreException.notFound(collection, id);
        }
        return value;
    }

    @Override
    public T store(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        String id = keyer.idOf(value);
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("keyer returned an empty id for " + value);
        }
        data.put(id, value);
        log.debug("内存存储写入: collection={}, id={}", collection, id);
        return value;
    }

    @Override
    public void remove(String id) {
        if (id == null) {
            return;
        }
        data.remove(id);
        log.debug("内存存储删除: collection={}, id={}", collection, id);
    }

    @Override
    public void bulkStore(Iterable<? extends T> values, BulkErrorHandling errorHandling) {
        BulkErrorCollector errors = new BulkErrorCollector(errorHandling);
        for (T value : values) {
            try {
                store(value);
            } catch (RuntimeException e) {
                errors.record(e);
            }
        }
        errors.throwIfAny();
    }

    @Override
    public void bulkRemove(Iterable<String> ids, BulkErrorHandling errorHandling) {
        BulkErrorCollector errors = new BulkErrorCollector(errorHandling);
        for (String id : ids) {
            try {
                remove(id);
            } catch (RuntimeException e) {
                errors.record(e);
            }
        }
        errors.throwIfAny();
    }

    @Override
    public Stream<Map.Entry<String, T>> all() {
        return new ArrayList<>(data.entrySet()).stream()
                .map(entry -> new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
    }

    public boolean contains(String id) {
        return data.containsKey(id);
    }

    public int size() {
        return data.size();
    }

    public String getCollection() {
        return collection;
    }
}
