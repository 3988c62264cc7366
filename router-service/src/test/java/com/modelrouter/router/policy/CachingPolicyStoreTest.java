package com.modelrouter.router.policy;

import com.modelrouter.common.exception.PolicyUnavailableException;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.common.model.PolicyMatchLevel;
import com.modelrouter.router.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CachingPolicyStoreTest {

    private static final PolicyMatch CODEGEN = new PolicyMatch("programming", "code-generation",
        PolicyMatchLevel.EXACT, List.of("gpt-4", "claude", "codex"), 10);
    private static final PolicyMatch CODEGEN_V2 = new PolicyMatch("programming", "code-generation",
        PolicyMatchLevel.EXACT, List.of("claude"), 10);

    private PolicyServiceClient client;
    private MutableClock clock;
    private CachingPolicyStore store;

    @BeforeEach
    void setUp() {
        client = mock(PolicyServiceClient.class);
        clock  = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
        store  = new CachingPolicyStore(client, clock, Duration.ofSeconds(30), Duration.ofMillis(100), 3);
    }

    @Test
    @DisplayName("fresh entry is served from cache without a second fetch")
    void freshHit() {
        when(client.fetchCandidates("programming", "code-generation")).thenReturn(Mono.just(CODEGEN));

        store.getCandidates("programming", "code-generation").block();
        clock.advance(Duration.ofSeconds(10));
        PolicyMatch second = store.getCandidates("programming", "code-generation").block();

        assertEquals(CODEGEN, second);
        verify(client, times(1)).fetchCandidates("programming", "code-generation");
    }

    @Test
    @DisplayName("expired entry is refetched")
    void expiredRefetch() {
        when(client.fetchCandidates("programming", "code-generation"))
            .thenReturn(Mono.just(CODEGEN), Mono.just(CODEGEN_V2));

        store.getCandidates("programming", "code-generation").block();
        clock.advance(Duration.ofSeconds(31));

        assertEquals(CODEGEN_V2, store.getCandidates("programming", "code-generation").block());
    }

    @Test
    @DisplayName("store down with a stale entry → stale entry served")
    void staleServedOnFailure() {
        when(client.fetchCandidates("programming", "code-generation"))
            .thenReturn(Mono.just(CODEGEN), Mono.error(new IllegalStateException("connection refused")));

        store.getCandidates("programming", "code-generation").block();
        clock.advance(Duration.ofMinutes(5));

        assertEquals(CODEGEN, store.getCandidates("programming", "code-generation").block());
    }

    @Test
    @DisplayName("store down and nothing ever cached → PolicyUnavailableException")
    void unavailable() {
        when(client.fetchCandidates("math", "proof"))
            .thenReturn(Mono.error(new IllegalStateException("connection refused")));

        assertThrows(PolicyUnavailableException.class, () -> store.getCandidates("math", "proof").block());
    }

    @Test
    @DisplayName("fetch exceeding the timeout is not cached and surfaces as unavailable")
    void timeoutNotCached() {
        when(client.fetchCandidates("math", "proof")).thenReturn(Mono.never(), Mono.just(CODEGEN));

        PolicyUnavailableException e = assertThrows(PolicyUnavailableException.class,
            () -> store.getCandidates("math", "proof").block());
        assertInstanceOf(TimeoutException.class, e.getCause());

        assertEquals(CODEGEN, store.getCandidates("math", "proof").block());
        verify(client, times(2)).fetchCandidates("math", "proof");
    }

    @Test
    @DisplayName("invalidate() forces the next lookup to refetch")
    void invalidate() {
        when(client.fetchCandidates("programming", "code-generation"))
            .thenReturn(Mono.just(CODEGEN), Mono.just(CODEGEN_V2));

        store.getCandidates("programming", "code-generation").block();
        store.invalidate();

        assertEquals(CODEGEN_V2, store.getCandidates("programming", "code-generation").block());
    }

    @Test
    @DisplayName("empty answer is cached as a NONE match")
    void emptyAnswer() {
        when(client.fetchCandidates("poetry", "haiku")).thenReturn(Mono.empty());

        PolicyMatch match = store.getCandidates("poetry", "haiku").block();

        assertNotNull(match);
        assertEquals(PolicyMatchLevel.NONE, match.matchLevel());
        assertTrue(match.isEmpty());
    }

    @Test
    @DisplayName("labels containing a slash do not share a cache entry")
    void slashInLabel() {
        PolicyMatch left  = new PolicyMatch("a/b", "c", PolicyMatchLevel.EXACT, List.of("left"), 1);
        PolicyMatch right = new PolicyMatch("a", "b/c", PolicyMatchLevel.EXACT, List.of("right"), 1);
        when(client.fetchCandidates("a/b", "c")).thenReturn(Mono.just(left));
        when(client.fetchCandidates("a", "b/c")).thenReturn(Mono.just(right));

        store.getCandidates("a/b", "c").block();

        assertEquals(right, store.getCandidates("a", "b/c").block());
        verify(client, times(1)).fetchCandidates("a", "b/c");
    }

    @Test
    @DisplayName("cache keeps at most max-entries labels, dropping the oldest fetch")
    void boundedSize() {
        for (String domain : List.of("d1", "d2", "d3", "d4")) {
            when(client.fetchCandidates(domain, "chat"))
                .thenReturn(Mono.just(PolicyMatch.none(domain, "chat")));
            store.getCandidates(domain, "chat").block();
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(3, store.size());

        store.getCandidates("d4", "chat").block();
        store.getCandidates("d1", "chat").block();
        verify(client, times(1)).fetchCandidates("d4", "chat");
        verify(client, times(2)).fetchCandidates("d1", "chat");
    }
}
