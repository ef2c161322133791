package com.vcc.router.service.firewall;

import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.TokenUsage;
import reactor.core.publisher.Mono;

/**
 * Detector backed by a judging model. Only consulted when the deterministic chain is inconclusive.
 */
public interface ContextualDetector {

    String NAME = "contextual";

    Mono<Judgement> judge(ModelDescriptor judgeModel, String output);

    /**
     * The judge's verdict and the tokens it took to reach it.
     */
    record Judgement(DetectionResult result, TokenUsage usage) {

        public Judgement {
            usage = usage != null ? usage : TokenUsage.none();
        }
    }
}
