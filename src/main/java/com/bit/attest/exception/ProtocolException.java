package com.bit.attest.exception;

/**
 * 协议层异常：统一封装错误类型与错误信息
 * 任何抛出该异常的操作都不会留下部分状态修改
 */
public class ProtocolException extends RuntimeException {

    private final ErrorType errorType;

    public ProtocolException(ErrorType errorType, String message) {
        super("[" + errorType.name() + "] " + message);
        this.errorType = errorType;
    }

    public ProtocolException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.name() + "] " + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static ProtocolException unauthorized(String message) {
        return new ProtocolException(ErrorType.AUTHORIZATION, message);
    }

    public static ProtocolException notFound(String message) {
        return new ProtocolException(ErrorType.NOT_FOUND, message);
    }

    public static ProtocolException invalid(String message) {
        return new ProtocolException(ErrorType.VALIDATION, message);
    }

    public static ProtocolException replay(String message) {
        return new ProtocolException(ErrorType.REPLAY, message);
    }

    public static ProtocolException duplicate(String message) {
        return new ProtocolException(ErrorType.DUPLICATE, message);
    }

    public static ProtocolException state(String message) {
        return new ProtocolException(ErrorType.STATE, message);
    }

    public static ProtocolException timing(String message) {
        return new ProtocolException(ErrorType.TIMING, message);
    }

    public static ProtocolException consensus(String message) {
        return new ProtocolException(ErrorType.CONSENSUS, message);
    }

    public static ProtocolException disputed(String message) {
        return new ProtocolException(ErrorType.DISPUTED, message);
    }
}
