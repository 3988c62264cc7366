package com.modelrouter.common.exception;

public class RoutingException extends RuntimeException {
    private final ErrorCode code;

    public RoutingException(ErrorCode code, String message) {
        super("[" + code + "] " + message);
        this.code = code;
    }

    public RoutingException(ErrorCode code, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
