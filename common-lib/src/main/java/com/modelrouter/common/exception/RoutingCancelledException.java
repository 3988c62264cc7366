package com.modelrouter.common.exception;

public class RoutingCancelledException extends RoutingException {

    public RoutingCancelledException(String message, Throwable cause) {
        super(ErrorCode.CANCELLED, message, cause);
    }
}
