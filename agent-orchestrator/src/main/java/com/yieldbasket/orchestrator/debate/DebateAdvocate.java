package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;
import reactor.core.publisher.Mono;

import java.util.List;

/** Produces one side's thesis for one round, given every thesis written so far by either side. */
public interface DebateAdvocate {

    /**
     * @param transcript all prior theses from both positions, oldest first
     * @param correction reason the previous attempt at this round was rejected, or {@code null}
     */
    Mono<DebateThesis> argue(DebatePosition position, DebateContext context,
                             List<DebateThesis> transcript, int round, String correction);
}
