package com.modelrouter.common.model;

/**
 * Liveness of an executor as last observed by the registry probe.
 * {@code UNKNOWN} until the first probe completes.
 */
public enum Liveness {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
