package cn.bafuka.tierstore.core;

/**
 * 按 {@link BulkErrorHandling} 汇总批量操作中的错误
 */
public class BulkErrorCollector {

    private final BulkErrorHandling errorHandling;

    private RuntimeException lastError;

    private int errorCount;

    public BulkErrorCollector(BulkErrorHandling errorHandling) {
        this.errorHandling = errorHandling == null ? BulkErrorHandling.FAIL_ON_FIRST_ERROR : errorHandling;
    }

    /**
     * 记录一个错误；FAIL_ON_FIRST_ERROR 模式下直接抛出
     *
     * @param error 单个元素处理失败的异常
     */
    public void record(RuntimeException error) {
        if (errorHandling == BulkErrorHandling.FAIL_ON_FIRST_ERROR) {
            throw error;
        }
        if (lastError != null) {
            error.addSuppressed(lastError);
        }
        lastError = error;
        errorCount++;
    }

    /**
     * 批量处理结束后调用，存在错误时抛出最后一个
     */
    public void throwIfAny() {
        if (lastError != null) {
            throw lastError;
        }
    }

    public int getErrorCount() {
        return errorCount;
    }
}
