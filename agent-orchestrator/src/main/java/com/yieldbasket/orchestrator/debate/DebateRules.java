package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Convergence and anti-sycophancy checks applied between rounds. */
public final class DebateRules {

    private DebateRules() {}

    public static boolean converged(DebateThesis change, DebateThesis hold, double gap) {
        return Math.abs(change.confidence() - hold.confidence()) < gap;
    }

    /**
     * A side may change its proposed action only by citing evidence that appears nowhere
     * in the transcript so far.
     *
     * @return the rejection reason, or empty when the thesis is admissible
     */
    public static Optional<String> checkPositionChange(DebateThesis candidate, List<DebateThesis> transcript) {
        DebateThesis previous = lastOf(candidate.position(), transcript);
        if (previous == null || previous.proposedAction() == candidate.proposedAction()) {
            return Optional.empty();
        }
        Set<String> seen = new HashSet<>();
        transcript.forEach(t -> t.evidence().forEach(e -> seen.add(canonical(e))));
        boolean cited = candidate.evidence().stream().anyMatch(e -> !seen.contains(canonical(e)));
        if (cited) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT,
            "%s switched from %s to %s in round %d without new evidence",
            candidate.position(), previous.proposedAction(), candidate.proposedAction(), candidate.round()));
    }

    /** Keeps the previous action and weights, carrying the new confidence and noting the rejected switch. */
    public static DebateThesis keepPrevious(DebateThesis rejected, List<DebateThesis> transcript, String reason) {
        DebateThesis previous = lastOf(rejected.position(), transcript);
        List<String> evidence = new ArrayList<>(previous.evidence());
        evidence.add("rejected: " + reason);
        return new DebateThesis(rejected.position(), previous.proposedAction(), previous.targetWeights(),
                                rejected.confidence(), evidence, rejected.round());
    }

    public static DebateThesis lastOf(DebatePosition position, List<DebateThesis> transcript) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).position() == position) return transcript.get(i);
        }
        return null;
    }

    private static String canonical(String evidence) {
        return evidence.trim().toLowerCase(Locale.ROOT);
    }
}
