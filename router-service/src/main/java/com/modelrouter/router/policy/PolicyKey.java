package com.modelrouter.router.policy;

/** Cache key for one classification label. */
record PolicyKey(String domain, String action) {

    @Override
    public String toString() {
        return domain + "/" + action;
    }
}
