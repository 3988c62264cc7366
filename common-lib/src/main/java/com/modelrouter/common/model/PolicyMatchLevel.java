package com.modelrouter.common.model;

/** Which rule of the most-specific-match order produced a policy lookup result. */
public enum PolicyMatchLevel {
    EXACT,
    DOMAIN,
    GLOBAL,
    NONE
}
