package com.modelrouter.policy.repository;

import com.modelrouter.policy.model.PolicyEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface PolicyRepository extends ReactiveCrudRepository<PolicyEntity, Long> {

    Mono<PolicyEntity> findByDomainAndAction(String domain, String action);

    /** Every policy that can match a lookup for {@code domain}: its own rows plus the wildcard rows. */
    Flux<PolicyEntity> findByDomainIn(Collection<String> domains);

    Flux<PolicyEntity> findAllByOrderByDomainAscActionAsc();
}
