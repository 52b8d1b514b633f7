package com.bit.vault.api;

import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 业务异常统一转换为 Result
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(VaultException.class)
    public Result<Void> handleVaultException(VaultException e) {
        log.warn("请求失败: {}", e.getMessage());
        if (e.getErrorType() == ErrorType.ACCESS_DENIED) {
            return Result.noauth(e.getErrorType().name(), e.getMessage());
        }
        if (e.getErrorType() == ErrorType.PERSIST_FAILED) {
            return Result.error(Result.SC_INTERNAL_SERVER_ERROR_500, e.getErrorType().name(), e.getMessage());
        }
        return Result.error(Result.SC_BAD_REQUEST_400, e.getErrorType().name(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Result<Void> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return Result.error(Result.SC_BAD_REQUEST_400, e.getMessage());
    }
}
