package com.bit.attest.web;

import com.bit.attest.exception.ErrorType;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 协议异常统一转换为 Result，HTTP 状态码取自错误类型
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Result<Void>> handleProtocol(ProtocolException ex) {
        ErrorType type = ex.getErrorType();
        if (type == ErrorType.STORAGE) {
            log.error("协议操作失败: {}", ex.getMessage(), ex);
        } else {
            log.warn("协议操作被拒绝: {}", ex.getMessage());
        }
        return build(type, ex.getMessage());
    }

    // 地址/十六进制格式错误、证明字段非法
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("请求参数非法: {}", ex.getMessage());
        return build(ErrorType.VALIDATION, "[VALIDATION] " + ex.getMessage());
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Result<Void>> handleBadRequest(Exception ex) {
        log.warn("请求格式错误: {}", ex.getMessage());
        return build(ErrorType.VALIDATION, "[VALIDATION] " + ex.getMessage());
    }

    private static ResponseEntity<Result<Void>> build(ErrorType type, String message) {
        return ResponseEntity.status(type.getHttpStatus())
                .body(Result.error(type.getHttpStatus(), type.name(), message));
    }
}
