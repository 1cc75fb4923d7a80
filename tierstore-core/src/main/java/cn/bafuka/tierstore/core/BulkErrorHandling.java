package cn.bafuka.tierstore.core;

/**
 * 批量操作的错误处理策略
 */
public enum BulkErrorHandling {

    /**
     * 遇到第一个错误立即中止并抛出
     */
    FAIL_ON_FIRST_ERROR,

    /**
     * 继续处理剩余元素，结束后抛出最后一个错误（之前的错误作为 suppressed 附加）
     */
    CONTINUE_COLLECTING_ERRORS
}
