package com.modelrouter.router.policy;

import com.modelrouter.common.model.PolicyMatch;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Thin WebClient wrapper over policy-service's candidates endpoint. No caching, no timeout. */
@Component
public class PolicyServiceClient {

    private final WebClient policyClient;

    public PolicyServiceClient(@Qualifier("policyClient") WebClient policyClient) {
        this.policyClient = policyClient;
    }

    public Mono<PolicyMatch> fetchCandidates(String domain, String action) {
        return policyClient.get()
            .uri(uri -> uri.path("/api/v1/policies/candidates")
                           .queryParam("domain", domain)
                           .queryParam("action", action)
                           .build())
            .retrieve()
            .bodyToMono(PolicyMatch.class);
    }
}
