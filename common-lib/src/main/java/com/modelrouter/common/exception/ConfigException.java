package com.modelrouter.common.exception;

/** Malformed executor registration or policy definition. Fatal only to that registration. */
public class ConfigException extends RoutingException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
