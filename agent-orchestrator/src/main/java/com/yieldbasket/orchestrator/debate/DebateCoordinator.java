package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.orchestrator.config.DebateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the bounded debate. Rounds are strictly sequential: in each round the change advocate
 * speaks first, then the hold advocate answers with the change thesis already in view.
 * Stops when the confidence gap closes below the configured threshold or the round cap is hit.
 */
@Service
public class DebateCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DebateCoordinator.class);

    private final DebateAdvocate advocate;
    private final DebateProperties properties;

    public DebateCoordinator(DebateAdvocate advocate, DebateProperties properties) {
        this.advocate   = advocate;
        this.properties = properties;
    }

    public Mono<DebateOutcome> debate(DebateContext context) {
        return Mono.defer(() -> {
            List<String> rejections = new ArrayList<>();
            return round(context, 1, List.of(), rejections);
        });
    }

    private Mono<DebateOutcome> round(DebateContext context, int round,
                                      List<DebateThesis> transcript, List<String> rejections) {
        return speak(DebatePosition.ADVOCATE_FOR_CHANGE, context, transcript, round, rejections)
            .flatMap(change -> {
                List<DebateThesis> withChange = append(transcript, change);
                return speak(DebatePosition.ADVOCATE_FOR_HOLD, context, withChange, round, rejections)
                    .map(hold -> append(withChange, hold));
            })
            .flatMap(updated -> {
                DebateThesis change = DebateRules.lastOf(DebatePosition.ADVOCATE_FOR_CHANGE, updated);
                DebateThesis hold   = DebateRules.lastOf(DebatePosition.ADVOCATE_FOR_HOLD, updated);
                boolean converged = DebateRules.converged(change, hold, properties.convergenceGap());
                log.info("[Debate] Round complete. round={} change={}@{} hold={}@{} converged={} traceId={}",
                    round, change.proposedAction(), change.confidence(),
                    hold.proposedAction(), hold.confidence(), converged, context.traceId());
                if (converged || round >= properties.maxRounds()) {
                    return Mono.just(new DebateOutcome(updated, round, converged, rejections));
                }
                return round(context, round + 1, updated, rejections);
            });
    }

    /** One side's turn, with reject-and-retry on an unsupported position change. */
    private Mono<DebateThesis> speak(DebatePosition position, DebateContext context,
                                     List<DebateThesis> transcript, int round, List<String> rejections) {
        return attempt(position, context, transcript, round, null, 0, rejections);
    }

    private Mono<DebateThesis> attempt(DebatePosition position, DebateContext context, List<DebateThesis> transcript,
                                       int round, String correction, int retries, List<String> rejections) {
        return advocate.argue(position, context, transcript, round, correction)
            .timeout(properties.roundTimeout())
            .onErrorResume(e -> Mono.just(unavailable(position, transcript, round, e)))
            .flatMap(thesis -> {
                Optional<String> rejection = DebateRules.checkPositionChange(thesis, transcript);
                if (rejection.isEmpty()) {
                    return Mono.just(thesis);
                }
                rejections.add(rejection.get());
                log.warn("[Debate] Thesis rejected. position={} round={} attempt={} reason={} traceId={}",
                    position, round, retries + 1, rejection.get(), context.traceId());
                if (retries < properties.maxRoundRetries()) {
                    return attempt(position, context, transcript, round, rejection.get(), retries + 1, rejections);
                }
                return Mono.just(DebateRules.keepPrevious(thesis, transcript, rejection.get()));
            });
    }

    /** Restates the side's last thesis, or a zero-confidence HOLD when it has none. */
    private DebateThesis unavailable(DebatePosition position, List<DebateThesis> transcript, int round, Throwable e) {
        String note = "round " + round + " advocate unavailable: " + e.getClass().getSimpleName();
        DebateThesis previous = DebateRules.lastOf(position, transcript);
        if (previous == null) {
            return new DebateThesis(position, DecisionAction.HOLD, Map.of(), 0.0, List.of(note), round);
        }
        List<String> evidence = new ArrayList<>(previous.evidence());
        evidence.add(note);
        return new DebateThesis(position, previous.proposedAction(), previous.targetWeights(),
                                previous.confidence(), evidence, round);
    }

    private static List<DebateThesis> append(List<DebateThesis> transcript, DebateThesis thesis) {
        List<DebateThesis> next = new ArrayList<>(transcript);
        next.add(thesis);
        return List.copyOf(next);
    }
}
