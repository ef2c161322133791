package com.vcc.router.service.lineage;

import com.vcc.router.model.DecisionTrace;
import reactor.core.publisher.Mono;

/**
 * Durable store for decision traces.
 */
public interface LineageSink {

    Mono<Void> write(DecisionTrace trace);
}
