package com.modelrouter.policy.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.Policy;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.common.policy.PolicyResolver;
import com.modelrouter.policy.exception.PolicyConflictException;
import com.modelrouter.policy.model.PolicyEntity;
import com.modelrouter.policy.repository.PolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator CRUD over routing policies plus the {@code GetCandidates} lookup the router calls.
 *
 * <p>Resolution loads only the rows that can match ({@code domain} and {@code *}) and hands
 * them to {@link PolicyResolver}, so the router and this service share one definition of
 * "most specific match".
 */
@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

    private final PolicyRepository repository;
    private final ObjectMapper objectMapper;

    public PolicyService(PolicyRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    public Mono<PolicyMatch> getCandidates(String domain, String action) {
        return repository.findByDomainIn(List.of(domain, Policy.WILDCARD))
            .map(this::toPolicy)
            .collectList()
            .map(policies -> PolicyResolver.resolve(domain, action, policies))
            .doOnNext(m -> log.debug("Candidates resolved. domain={} action={} matchLevel={} candidates={}",
                                     domain, action, m.matchLevel(), m.candidateModelIds()));
    }

    public Flux<Policy> findAll() {
        return repository.findAllByOrderByDomainAscActionAsc().map(this::toPolicy);
    }

    public Mono<Policy> find(String domain, String action) {
        return repository.findByDomainAndAction(domain, action).map(this::toPolicy);
    }

    public Mono<Policy> create(Policy policy) {
        return Mono.fromRunnable(() -> validate(policy))
            .then(Mono.defer(() -> repository.findByDomainAndAction(policy.domain(), policy.action()).hasElement()))
            .flatMap(exists -> exists
                ? Mono.<PolicyEntity>error(new PolicyConflictException(policy.domain(), policy.action()))
                : repository.save(toEntity(new PolicyEntity(), policy)))
            .map(this::toPolicy)
            .doOnNext(p -> log.info("Policy created. domain={} action={} candidates={} priority={}",
                                    p.domain(), p.action(), p.candidateModelIds(), p.priority()));
    }

    /** Replaces the candidate list and priority. Emits empty when no such policy exists. */
    public Mono<Policy> update(String domain, String action, Policy policy) {
        Policy target = new Policy(domain, action, policy.candidateModelIds(), policy.priority());
        return Mono.fromRunnable(() -> validate(target))
            .then(Mono.defer(() -> repository.findByDomainAndAction(domain, action)))
            .flatMap(existing -> repository.save(toEntity(existing, target)))
            .map(this::toPolicy)
            .doOnNext(p -> log.info("Policy updated. domain={} action={} candidates={} priority={}",
                                    p.domain(), p.action(), p.candidateModelIds(), p.priority()));
    }

    /** Emits true when a policy was deleted, false when none existed. */
    public Mono<Boolean> delete(String domain, String action) {
        return repository.findByDomainAndAction(domain, action)
            .flatMap(existing -> repository.delete(existing).thenReturn(true))
            .defaultIfEmpty(false)
            .doOnNext(deleted -> {
                if (deleted) log.info("Policy deleted. domain={} action={}", domain, action);
            });
    }

    // ── validation and mapping ───────────────────────────────────────────────

    static void validate(Policy policy) {
        if (policy.domain() == null || policy.domain().isBlank()
                || policy.action() == null || policy.action().isBlank()) {
            throw new ConfigException("Policy domain and action are required");
        }
        if (Policy.WILDCARD.equals(policy.domain()) && !Policy.WILDCARD.equals(policy.action())) {
            throw new ConfigException("A wildcard domain requires a wildcard action");
        }
        if (policy.candidateModelIds().isEmpty()) {
            throw new ConfigException("Policy " + policy.domain() + "/" + policy.action()
                                      + " must name at least one candidate model");
        }
        Set<String> seen = new HashSet<>();
        for (String id : policy.candidateModelIds()) {
            if (id == null || id.isBlank()) {
                throw new ConfigException("Policy " + policy.domain() + "/" + policy.action()
                                          + " contains a blank model id");
            }
            if (!seen.add(id)) {
                throw new ConfigException("Policy " + policy.domain() + "/" + policy.action()
                                          + " lists " + id + " more than once");
            }
        }
    }

    private PolicyEntity toEntity(PolicyEntity entity, Policy policy) {
        LocalDateTime now = LocalDateTime.now();
        entity.setDomain(policy.domain());
        entity.setAction(policy.action());
        entity.setPriority(policy.priority());
        try {
            entity.setCandidateModelIds(objectMapper.writeValueAsString(policy.candidateModelIds()));
        } catch (JsonProcessingException e) {
            throw new ConfigException("Unserialisable candidate list for " + policy.domain() + "/" + policy.action(), e);
        }
        if (entity.getCreatedAt() == null) entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    private Policy toPolicy(PolicyEntity entity) {
        List<String> ids;
        try {
            ids = entity.getCandidateModelIds() == null
                ? List.of()
                : objectMapper.readValue(entity.getCandidateModelIds(), ID_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable candidate list, treating as empty. domain={} action={}",
                     entity.getDomain(), entity.getAction(), e);
            ids = List.of();
        }
        return new Policy(entity.getDomain(), entity.getAction(), ids, entity.getPriority());
    }
}
