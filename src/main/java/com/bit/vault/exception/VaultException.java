package com.bit.vault.exception;

/**
 * 记账核心统一异常：任何一步失败都使整个操作回滚，不产生部分效果
 */
public class VaultException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public VaultException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    // 带cause异常（链式追踪）
    public VaultException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
