package com.modelrouter.router.policy;

import com.modelrouter.common.model.PolicyMatch;
import reactor.core.publisher.Mono;

/**
 * Router-side view of the policy store. Read-only.
 */
public interface PolicyStore {

    /**
     * Ordered candidate ids for the pair, resolved exact → domain wildcard → global default.
     * Emits an empty {@link PolicyMatch} when nothing matches.
     */
    Mono<PolicyMatch> getCandidates(String domain, String action);

    /** Marks every cached entry stale so the next lookup refetches. */
    void invalidate();
}
