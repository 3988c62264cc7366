package com.modelrouter.common.policy;

import com.modelrouter.common.model.Policy;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.common.model.PolicyMatchLevel;

import java.util.Collection;

/**
 * Pure most-specific-match resolution over a set of policies.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>exact {@code (domain, action)}        → {@link PolicyMatchLevel#EXACT}</li>
 *   <li>{@code (domain, *)} wildcard          → {@link PolicyMatchLevel#DOMAIN}</li>
 *   <li>{@code (*, *)} global default         → {@link PolicyMatchLevel#GLOBAL}</li>
 *   <li>nothing                               → {@link PolicyMatchLevel#NONE}, empty list</li>
 * </ol>
 *
 * <p>A matching policy with an empty candidate list still wins its level; it does not fall
 * through to a broader rule. Domain and action compare case-sensitively.
 */
public final class PolicyResolver {

    private PolicyResolver() {}

    public static PolicyMatch resolve(String domain, String action, Collection<Policy> policies) {
        Policy exact = null;
        Policy domainWide = null;
        Policy global = null;
        for (Policy p : policies) {
            if (p.domain().equals(domain) && p.action().equals(action)) {
                exact = p;
            } else if (p.domain().equals(domain) && Policy.WILDCARD.equals(p.action())) {
                domainWide = p;
            } else if (Policy.WILDCARD.equals(p.domain()) && Policy.WILDCARD.equals(p.action())) {
                global = p;
            }
        }
        if (exact != null)      return match(domain, action, PolicyMatchLevel.EXACT, exact);
        if (domainWide != null) return match(domain, action, PolicyMatchLevel.DOMAIN, domainWide);
        if (global != null)     return match(domain, action, PolicyMatchLevel.GLOBAL, global);
        return PolicyMatch.none(domain, action);
    }

    private static PolicyMatch match(String domain, String action, PolicyMatchLevel level, Policy policy) {
        return new PolicyMatch(domain, action, level, policy.candidateModelIds(), policy.priority());
    }
}
