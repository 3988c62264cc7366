package com.modelrouter.decisionlog.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.ScoredCandidate;
import com.modelrouter.decisionlog.exception.DecisionConflictException;
import com.modelrouter.decisionlog.model.DecisionLogEntry;
import com.modelrouter.decisionlog.repository.DecisionLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionLogServiceTest {

    private static final Instant DECIDED = Instant.parse("2026-03-01T10:15:30Z");

    private DecisionLogRepository repository;
    private DecisionLogService service;

    @BeforeEach
    void setUp() {
        repository = mock(DecisionLogRepository.class);
        service    = new DecisionLogService(repository, new ObjectMapper());
        when(repository.save(any(DecisionLogEntry.class)))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0, DecisionLogEntry.class)));
    }

    private static DecisionRecord record(String decisionId, String parentId) {
        return new DecisionRecord(
            decisionId, parentId, "trace-1", "write a python function",
            Classification.of("programming", "code-generation", 0.9, "code request"),
            new QueryFeatures(12, 0.4, true, 3, List.of("code", "python"), false, 0, 0.2),
            List.of(new ScoredCandidate("claude", "anthropic", 3.0, 1, 0.8, 0.4, false, "top"),
                    new ScoredCandidate("gpt-4", "openai", 5.0, 0, 0.8, 0.3, false, "second")),
            Set.of("codex"), "claude", DECIDED.minusMillis(40), DECIDED, null);
    }

    @Nested
    @DisplayName("append()")
    class AppendTests {

        @Test
        @DisplayName("persists the full decision with JSON columns and UTC timestamps")
        void persists() {
            when(repository.existsByDecisionId("d-1")).thenReturn(Mono.just(false));

            DecisionRecord saved = service.append(record("d-1", null)).block();

            ArgumentCaptor<DecisionLogEntry> captor = ArgumentCaptor.forClass(DecisionLogEntry.class);
            verify(repository).save(captor.capture());
            DecisionLogEntry entry = captor.getValue();
            assertEquals("programming", entry.getDomain());
            assertEquals("code-generation", entry.getAction());
            assertFalse(entry.isClassificationFallback());
            assertEquals(LocalDateTime.of(2026, 3, 1, 10, 15, 30), entry.getDecidedAt());
            assertTrue(entry.getCandidates().contains("\"modelId\":\"claude\""));
            assertNull(entry.getOutcomeStatus());

            assertNotNull(saved);
            assertEquals("claude", saved.selectedModelId());
            assertEquals(List.of("claude", "gpt-4"),
                         saved.candidates().stream().map(ScoredCandidate::modelId).toList());
            assertEquals(Set.of("codex"), saved.excludedModelIds());
            assertEquals(DECIDED, saved.decidedAt());
            assertEquals(List.of("code", "python"), saved.features().domainKeywords());
        }

        @Test
        @DisplayName("keeps the parent link of a reselection")
        void keepsParent() {
            when(repository.existsByDecisionId("d-2")).thenReturn(Mono.just(false));

            DecisionRecord saved = service.append(record("d-2", "d-1")).block();

            assertEquals("d-1", saved.parentDecisionId());
        }

        @Test
        @DisplayName("rejects a decision id that is already logged")
        void duplicate() {
            when(repository.existsByDecisionId("d-1")).thenReturn(Mono.just(true));

            assertThrows(DecisionConflictException.class,
                         () -> service.append(record("d-1", null)).block());
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("rejects a record without a decision id")
        void missingId() {
            assertThrows(ConfigException.class, () -> service.append(record(" ", null)).block());
            verify(repository, never()).existsByDecisionId(anyString());
        }
    }

    @Nested
    @DisplayName("recordOutcome()")
    class OutcomeTests {

        private final DecisionOutcome success =
            new DecisionOutcome(DecisionOutcome.Status.SUCCESS, 812L, null, DECIDED.plusSeconds(2));

        @Test
        @DisplayName("first outcome is written and the updated record returned")
        void firstWrite() {
            DecisionLogEntry stored = new DecisionLogEntry();
            stored.setDecisionId("d-1");
            stored.setSelectedModelId("claude");
            stored.setDecidedAt(LocalDateTime.of(2026, 3, 1, 10, 15, 30));
            stored.setOutcomeStatus("SUCCESS");
            stored.setOutcomeLatencyMs(812L);
            stored.setOutcomeRecordedAt(LocalDateTime.of(2026, 3, 1, 10, 15, 32));
            when(repository.recordOutcomeOnce(eq("d-1"), eq("SUCCESS"), eq(812L), any(),
                                              eq(LocalDateTime.of(2026, 3, 1, 10, 15, 32))))
                .thenReturn(Mono.just(1));
            when(repository.findByDecisionId("d-1")).thenReturn(Mono.just(stored));

            DecisionRecord updated = service.recordOutcome("d-1", success).block();

            assertNotNull(updated);
            assertEquals(DecisionOutcome.Status.SUCCESS, updated.outcome().status());
            assertEquals(812L, updated.outcome().latencyMs());
            assertEquals(DECIDED.plusSeconds(2), updated.outcome().recordedAt());
        }

        @Test
        @DisplayName("second outcome for the same decision is a conflict")
        void secondWrite() {
            when(repository.recordOutcomeOnce(anyString(), anyString(), any(), any(), any()))
                .thenReturn(Mono.just(0));
            when(repository.existsByDecisionId("d-1")).thenReturn(Mono.just(true));

            assertThrows(DecisionConflictException.class,
                         () -> service.recordOutcome("d-1", success).block());
        }

        @Test
        @DisplayName("unknown decision completes empty")
        void unknown() {
            when(repository.recordOutcomeOnce(anyString(), anyString(), any(), any(), any()))
                .thenReturn(Mono.just(0));
            when(repository.existsByDecisionId("nope")).thenReturn(Mono.just(false));

            assertNull(service.recordOutcome("nope", success).block());
        }

        @Test
        @DisplayName("missing status is rejected before touching the store")
        void missingStatus() {
            DecisionOutcome blank = new DecisionOutcome(null, 10L, null, null);

            assertThrows(ConfigException.class, () -> service.recordOutcome("d-1", blank).block());
            verify(repository, never()).recordOutcomeOnce(anyString(), anyString(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("recent()")
    class RecentTests {

        @Test
        @DisplayName("clamps the limit into the allowed range")
        void clamps() {
            when(repository.findRecent(anyInt())).thenReturn(Flux.empty());

            service.recent(0).collectList().block();
            service.recent(10_000).collectList().block();

            verify(repository).findRecent(1);
            verify(repository).findRecent(DecisionLogService.MAX_RECENT);
        }
    }
}
