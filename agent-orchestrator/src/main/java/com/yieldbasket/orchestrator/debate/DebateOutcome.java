package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;

import java.util.List;

/**
 * Full transcript of one debate. Downstream stages read only the last round;
 * the whole sequence is kept for the decision audit trail.
 */
public record DebateOutcome(List<DebateThesis> theses, int rounds, boolean converged, List<String> rejections) {

    public DebateOutcome {
        theses     = List.copyOf(theses);
        rejections = List.copyOf(rejections);
    }

    public DebateThesis finalChange() {
        return last(DebatePosition.ADVOCATE_FOR_CHANGE);
    }

    public DebateThesis finalHold() {
        return last(DebatePosition.ADVOCATE_FOR_HOLD);
    }

    private DebateThesis last(DebatePosition position) {
        for (int i = theses.size() - 1; i >= 0; i--) {
            if (theses.get(i).position() == position) return theses.get(i);
        }
        throw new IllegalStateException("no thesis for " + position);
    }
}
