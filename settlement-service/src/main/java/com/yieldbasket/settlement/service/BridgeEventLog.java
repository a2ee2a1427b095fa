package com.yieldbasket.settlement.service;

import com.yieldbasket.settlement.model.BridgeEvent;
import com.yieldbasket.settlement.model.BridgeState;
import com.yieldbasket.settlement.repository.BridgeEventRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.LocalDateTime;

/** Append-only transition log, also pushed to live subscribers. */
@Service
public class BridgeEventLog {

    private final BridgeEventRepository repository;
    private final Clock clock;
    private final Sinks.Many<BridgeEvent> eventSink =
        Sinks.many().multicast().onBackpressureBuffer(64);

    public BridgeEventLog(BridgeEventRepository repository, Clock clock) {
        this.repository = repository;
        this.clock      = clock;
    }

    public Mono<BridgeEvent> append(long jobId, BridgeState from, BridgeState to, String detail) {
        BridgeEvent event = new BridgeEvent();
        event.setJobId(jobId);
        event.setFromState(from != null ? from.name() : null);
        event.setToState(to.name());
        event.setDetail(detail);
        event.setCreatedAt(LocalDateTime.now(clock));
        return repository.save(event)
            .doOnNext(eventSink::tryEmitNext);
    }

    public Flux<BridgeEvent> forJob(long jobId) {
        return repository.findByJobIdOrderByIdAsc(jobId);
    }

    public Flux<BridgeEvent> stream() {
        return eventSink.asFlux();
    }
}
