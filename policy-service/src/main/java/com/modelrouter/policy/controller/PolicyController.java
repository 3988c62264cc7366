package com.modelrouter.policy.controller;

import com.modelrouter.common.model.Policy;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.policy.service.PolicyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private static final Logger log = LoggerFactory.getLogger(PolicyController.class);

    private final PolicyService policyService;

    public PolicyController(PolicyService policyService) {
        this.policyService = policyService;
    }

    /** Router lookup: most specific policy for the pair, or an empty NONE match. */
    @GetMapping("/candidates")
    public Mono<PolicyMatch> candidates(@RequestParam String domain, @RequestParam String action) {
        return policyService.getCandidates(domain, action);
    }

    @GetMapping
    public Flux<Policy> list() {
        return policyService.findAll();
    }

    @GetMapping("/{domain}/{action}")
    public Mono<ResponseEntity<Policy>> get(@PathVariable String domain, @PathVariable String action) {
        return policyService.find(domain, action)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping
    public Mono<ResponseEntity<Policy>> create(@RequestBody Policy policy) {
        log.info("Policy create requested. domain={} action={}", policy.domain(), policy.action());
        return policyService.create(policy)
            .map(p -> ResponseEntity.status(HttpStatus.CREATED).body(p));
    }

    @PutMapping("/{domain}/{action}")
    public Mono<ResponseEntity<Policy>> update(@PathVariable String domain, @PathVariable String action,
                                               @RequestBody Policy policy) {
        return policyService.update(domain, action, policy)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{domain}/{action}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String domain, @PathVariable String action) {
        return policyService.delete(domain, action)
            .map(deleted -> deleted
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }
}
