package com.yieldbasket.history.service;

import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.history.model.DecisionRecord;
import com.yieldbasket.history.repository.DecisionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DecisionHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock private DecisionRecordRepository repository;

    private DecisionHistoryService service;

    @BeforeEach
    void setUp() {
        service = new DecisionHistoryService(repository, HistoryFixtures.MAPPER, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("new decision is stored with its full payload and pushed to live subscribers")
    void savesNewDecision() {
        Decision decision = HistoryFixtures.decision("d-1", DecisionAction.REBALANCE, NOW);
        when(repository.findByDecisionId("d-1")).thenReturn(Mono.empty());
        when(repository.save(any(DecisionRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(service.stream().take(1))
            .then(() -> StepVerifier.create(service.save(decision))
                .assertNext(saved -> assertEquals("d-1", saved.decisionId()))
                .verifyComplete())
            .assertNext(streamed -> assertEquals("d-1", streamed.decisionId()))
            .verifyComplete();

        ArgumentCaptor<DecisionRecord> captor = ArgumentCaptor.forClass(DecisionRecord.class);
        verify(repository).save(captor.capture());
        DecisionRecord record = captor.getValue();
        assertEquals("REBALANCE", record.getAction());
        assertEquals(Boolean.FALSE, record.getReflected());
        assertThat(record.getPayload()).contains("\"decisionId\":\"d-1\"");
    }

    @Test
    @DisplayName("a repeated decision id keeps the stored decision")
    void duplicateKeepsOriginal() throws Exception {
        Decision original = HistoryFixtures.decision("d-1", DecisionAction.HOLD, NOW);
        Decision retry = HistoryFixtures.decision("d-1", DecisionAction.REBALANCE, NOW);
        when(repository.findByDecisionId("d-1")).thenReturn(Mono.just(HistoryFixtures.record(original, false)));

        StepVerifier.create(service.save(retry))
            .assertNext(saved -> assertEquals(DecisionAction.HOLD, saved.action()))
            .verifyComplete();

        verify(repository, never()).save(any());
    }

    @Test
    void latestRoundTripsPayloadAndBoundsLimit() throws Exception {
        Decision decision = HistoryFixtures.decision("d-2", DecisionAction.REBALANCE, NOW);
        when(repository.findLatest(anyInt())).thenReturn(Flux.just(HistoryFixtures.record(decision, false)));

        StepVerifier.create(service.latest(10_000))
            .assertNext(list -> {
                assertThat(list).hasSize(1);
                Decision read = list.get(0);
                assertEquals(decision.finalWeights(), read.finalWeights());
                assertEquals(4, read.reports().size());
                assertTrue(read.reports().get(2).isError());
                assertEquals(NOW, read.createdAt());
            })
            .verifyComplete();

        verify(repository).findLatest(DecisionHistoryService.MAX_LIMIT);
    }
}
