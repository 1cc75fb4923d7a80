package cn.bafuka.tierstore.manager.impl;

import cn.bafuka.tierstore.codec.ValueCodec;
import cn.bafuka.tierstore.codec.ValueCodecFactory;
import cn.bafuka.tierstore.core.CacheOptions;
import cn.bafuka.tierstore.core.CacheStats;
import cn.bafuka.tierstore.core.Keyer;
import cn.bafuka.tierstore.fastcache.FastCache;
import cn.bafuka.tierstore.manager.TieredStoreManager;
import cn.bafuka.tierstore.store.CollectionStore;
import cn.bafuka.tierstore.store.TierFailureListener;
import cn.bafuka.tierstore.store.TieredStore;
import cn.bafuka.tierstore.store.impl.DefaultTieredStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 分层存储管理器默认实现
 */
@Slf4j
public class DefaultTieredStoreManager implements TieredStoreManager {

    /**
     * 共享的快速缓存（可为 null，表示不使用缓存层）
     */
    private final FastCache fastCache;

    /**
     * 交给各存储的包装，存储关闭时不会关闭共享缓存
     */
    private final FastCache sharedFastCache;

    private final CacheOptions defaultOptions;

    /**
     * 集合名称 -> 覆盖后的完整配置
     */
    private final Map<String, CacheOptions> collectionOptions;

    private final ValueCodecFactory codecFactory;

    private final TierFailureListener failureListener;

    private final Map<String, TieredStore<?>> stores = new ConcurrentHashMap<>();

    private volatile boolean shutdown = false;

    public DefaultTieredStoreManager(FastCache fastCache, CacheOptions defaultOptions, ValueCodecFactory codecFactory) {
        this(fastCache, defaultOptions, Collections.emptyMap(), codecFactory, TierFailureListener.NONE);
    }

    public DefaultTieredStoreManager(FastCache fastCache,
                                     CacheOptions defaultOptions,
                                     Map<String, CacheOptions> collectionOptions,
                                     ValueCodecFactory codecFactory,
                                     TierFailureListener failureListener) {
        if (defaultOptions == null) {
            throw new IllegalArgumentException("defaultOptions must not be null");
        }
        if (codecFactory == null) {
            throw new IllegalArgumentException("codecFactory must not be null");
        }
        defaultOptions.validate();
        collectionOptions.values().forEach(CacheOptions::validate);

        this.fastCache = fastCache;
        this.sharedFastCache = fastCache == null ? null : new SharedFastCache(fastCache);
        this.defaultOptions = defaultOptions;
        this.collectionOptions = new LinkedHashMap<>(collectionOptions);
        this.codecFactory = codecFactory;
        this.failureListener = failureListener == null ? TierFailureListener.NONE : failureListener;

        log.info("分层存储管理器已创建: fastCache={}, defaults={}, overrides={}",
                fastCache == null ? "none" : fastCache.getClass().getSimpleName(),
                defaultOptions, this.collectionOptions.keySet());
    }

    @Override
    public <T> TieredStore<T> createStore(String collection, CollectionStore<T> backingStore,
                                          Keyer<T> keyer, Class<T> type) {
        return createStore(collection, backingStore, keyer, codecFactory.forType(type), resolveOptions(collection));
    }

    @Override
    public <T> TieredStore<T> createStore(String collection, CollectionStore<T> backingStore, Keyer<T> keyer,
                                          ValueCodec<T> codec, CacheOptions options) {
        if (shutdown) {
            throw new IllegalStateException("TieredStoreManager is shut down");
        }
        if (collection == null) {
            throw new IllegalArgumentException("collection name must not be null");
        }
        if (stores.containsKey(collection)) {
            throw new IllegalStateException("store already registered for collection: " + collection);
        }

        DefaultTieredStore<T> store = new DefaultTieredStore<>(
                backingStore, sharedFastCache, collection, keyer, codec, options, failureListener);
        if (stores.putIfAbsent(collection, store) != null) {
            store.close();
            throw new IllegalStateException("store already registered for collection: " + collection);
        }
        log.info("注册分层存储: collection={}, strategy={}", collection, options.getStrategy());
        return store;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TieredStore<T> getStore(String collection) {
        return (TieredStore<T>) stores.get(collection);
    }

    @Override
    public CacheOptions resolveOptions(String collection) {
        return collectionOptions.getOrDefault(collection, defaultOptions);
    }

    @Override
    public Set<String> getCollectionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(stores.keySet()));
    }

    @Override
    public boolean closeStore(String collection) {
        TieredStore<?> store = stores.remove(collection);
        if (store == null) {
            return false;
        }
        store.close();
        log.info("注销分层存储: collection={}", collection);
        return true;
    }

    @Override
    public CacheStats getStats(String collection) {
        TieredStore<?> store = stores.get(collection);
        return store == null ? null : store.getStats();
    }

    @Override
    public Map<String, CacheStats> getAllStats() {
        Map<String, CacheStats> result = new LinkedHashMap<>();
        for (String collection : getCollectionNames()) {
            CacheStats stats = getStats(collection);
            if (stats != null) {
                result.put(collection, stats);
            }
        }
        return result;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("关闭分层存储管理器，存储数量: {}", stores.size());

        List<String> collections = new ArrayList<>(stores.keySet());
        for (String collection : collections) {
            try {
                closeStore(collection);
            } catch (RuntimeException e) {
                log.error("关闭分层存储失败: collection={}", collection, e);
            }
        }

        if (fastCache != null) {
            try {
                fastCache.close();
            } catch (RuntimeException e) {
                log.error("关闭快速缓存失败", e);
            }
        }
        log.info("分层存储管理器已关闭");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * 共享快速缓存包装：转发读写，忽略关闭
     */
    private static final class SharedFastCache implements FastCache {

        private final FastCache delegate;

        private SharedFastCache(FastCache delegate) {
            this.delegate = delegate;
        }

        @Override
        public String get(String key) {
            return delegate.get(key);
        }

        @Override
        public void set(String key, String value, Duration ttl) {
            delegate.set(key, value, ttl);
        }

        @Override
        public void delete(String... keys) {
            delegate.delete(keys);
        }

        @Override
        public void close() {
            // 由管理器统一关闭
        }
    }
}
