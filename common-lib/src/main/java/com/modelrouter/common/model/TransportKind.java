package com.modelrouter.common.model;

import java.util.Locale;

/**
 * How the router reaches an executor to probe it. Each kind is served by its own
 * transport adapter in router-service; the Router itself never branches on this value.
 */
public enum TransportKind {
    HTTP,
    CLI,
    RPC;

    /**
     * Lenient parse for operator-supplied descriptors ("http", "Cli", ...).
     * Returns null for blank or unknown values so the caller can raise a config error.
     */
    public static TransportKind parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
