package com.modelrouter.common.exception;

import java.time.Duration;

public class ClassificationTimeoutException extends RoutingException {

    public ClassificationTimeoutException(Duration timeout, Throwable cause) {
        super(ErrorCode.CLASSIFICATION_TIMEOUT,
              "Task classifier did not answer within " + timeout.toMillis() + "ms", cause);
    }
}
