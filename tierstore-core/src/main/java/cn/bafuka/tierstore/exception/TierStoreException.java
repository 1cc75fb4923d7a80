package cn.bafuka.tierstore.exception;

/**
 * TierStore 异常
 * 未找到数据、序列化失败等场景抛出；后端存储在同步路径上的异常原样透传，不会被包装成本异常
 *
 * @author TierStore Team
 * @since 1.0
 */
public class TierStoreException extends RuntimeException {

    /**
     * 集合名称
     */
    private final String collection;

    /**
     * 数据 id（或缓存键）
     */
    private final String id;

    /**
     * 失败原因
     */
    private final Reason reason;

    public TierStoreException(String message, Throwable cause,
                              String collection, String id, Reason reason) {
        super(message, cause);
        this.collection = collection;
        this.id = id;
        this.reason = reason;
    }

    public TierStoreException(String message, String collection, String id, Reason reason) {
        this(message, null, collection, id, reason);
    }

    /**
     * 两层都找不到数据（WRITE_BEHIND 下仅快速缓存未命中）
     */
    public static TierStoreException notFound(String collection, String id) {
        return new TierStoreException(
                String.format("item not found: collection=%s, id=%s", collection, id),
                collection, id, Reason.NOT_FOUND);
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isNotFound() {
        return reason == Reason.NOT_FOUND;
    }

    /**
     * 失败原因枚举
     */
    public enum Reason {
        /**
         * 数据不存在
         */
        NOT_FOUND("数据不存在"),

        /**
         * 后端存储错误
         */
        BACKING_STORE_ERROR("后端存储错误"),

        /**
         * 快速缓存错误
         */
        CACHE_TIER_ERROR("快速缓存错误"),

        /**
         * 序列化/反序列化错误
         */
        SERIALIZATION_ERROR("序列化错误");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "TierStoreException{" +
                "collection=" + collection +
                ", id=" + id +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
