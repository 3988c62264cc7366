package com.modelrouter.common.exception;

public class MalformedClassificationException extends RoutingException {

    public MalformedClassificationException(String message) {
        super(ErrorCode.CLASSIFICATION_MALFORMED, message);
    }

    public MalformedClassificationException(String message, Throwable cause) {
        super(ErrorCode.CLASSIFICATION_MALFORMED, message, cause);
    }
}
