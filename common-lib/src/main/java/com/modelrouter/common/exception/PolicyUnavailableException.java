package com.modelrouter.common.exception;

/** Policy store unreachable and no cached value was ever loaded for the key. */
public class PolicyUnavailableException extends RoutingException {

    public PolicyUnavailableException(String domain, String action, Throwable cause) {
        super(ErrorCode.POLICY_UNAVAILABLE,
              "Policy store unavailable and nothing cached for " + domain + "/" + action, cause);
    }
}
