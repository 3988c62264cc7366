package com.modelrouter.router.policy;

import com.modelrouter.common.exception.PolicyUnavailableException;
import com.modelrouter.common.model.PolicyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache in front of {@link PolicyServiceClient}.
 *
 * <ul>
 *   <li>fresh entry: served without I/O</li>
 *   <li>stale or missing: refetched under {@code router.policy.timeout}</li>
 *   <li>refetch failed, stale entry present: stale entry served, WARN logged</li>
 *   <li>refetch failed, nothing ever cached: {@link PolicyUnavailableException}</li>
 * </ul>
 *
 * <p>Only completed fetches are written back; a fetch cancelled by the caller's deadline
 * leaves the cache untouched. At most {@code router.policy.max-entries} labels are kept; the
 * least recently fetched one goes first.
 */
@Component
public class CachingPolicyStore implements PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(CachingPolicyStore.class);

    private final ConcurrentHashMap<PolicyKey, CachedPolicy> cache = new ConcurrentHashMap<>();
    private final PolicyServiceClient client;
    private final Clock clock;
    private final Duration ttl;
    private final Duration timeout;
    private final int maxEntries;

    public CachingPolicyStore(PolicyServiceClient client, Clock clock,
                              @Value("${router.policy.cache-ttl:30s}") Duration ttl,
                              @Value("${router.policy.timeout:500ms}") Duration timeout,
                              @Value("${router.policy.max-entries:1024}") int maxEntries) {
        this.client     = client;
        this.clock      = clock;
        this.ttl        = ttl;
        this.timeout    = timeout;
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Mono<PolicyMatch> getCandidates(String domain, String action) {
        PolicyKey key = new PolicyKey(domain, action);
        CachedPolicy cached = cache.get(key);
        if (cached != null && !isExpired(cached)) {
            return Mono.just(cached.match());
        }
        return client.fetchCandidates(domain, action)
            .timeout(timeout)
            .switchIfEmpty(Mono.just(PolicyMatch.none(domain, action)))
            .doOnNext(match -> {
                cache.put(key, new CachedPolicy(match, clock.instant()));
                evictOverflow(key);
                log.info("POLICY_CACHE_REFRESH key={} matchLevel={} candidates={}",
                         key, match.matchLevel(), match.candidateModelIds().size());
            })
            .onErrorResume(e -> {
                if (cached != null) {
                    log.warn("Policy store unavailable, serving stale entry. key={} ageSeconds={} reason={}",
                             key, Duration.between(cached.fetchedAt(), clock.instant()).toSeconds(), e.toString());
                    return Mono.just(cached.match());
                }
                return Mono.error(new PolicyUnavailableException(domain, action, e));
            });
    }

    @Override
    public void invalidate() {
        cache.replaceAll((key, entry) -> new CachedPolicy(entry.match(), Instant.EPOCH));
        log.info("POLICY_CACHE_INVALIDATED entries={}", cache.size());
    }

    int size() {
        return cache.size();
    }

    private void evictOverflow(PolicyKey keep) {
        while (cache.size() > maxEntries) {
            PolicyKey oldest = cache.entrySet().stream()
                .filter(e -> !e.getKey().equals(keep))
                .min(Comparator.comparing((Map.Entry<PolicyKey, CachedPolicy> e) -> e.getValue().fetchedAt()))
                .map(Map.Entry::getKey)
                .orElse(null);
            if (oldest == null) return;
            cache.remove(oldest);
            log.debug("POLICY_CACHE_EVICT key={}", oldest);
        }
    }

    private boolean isExpired(CachedPolicy entry) {
        return !clock.instant().isBefore(entry.fetchedAt().plus(ttl));
    }
}
