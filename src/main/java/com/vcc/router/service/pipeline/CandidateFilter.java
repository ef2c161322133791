package com.vcc.router.service.pipeline;

import com.vcc.router.exception.DenyReason;
import com.vcc.router.model.CandidateSet;

/**
 * One narrowing stage of the routing pipeline. Takes and returns the same shape, never widens
 * the set, and may annotate the request's trace.
 */
public interface CandidateFilter {

    /**
     * Stage name used for timing breakdowns and logging.
     */
    String name();

    CandidateSet apply(CandidateSet candidates, RoutingContext context);

    /**
     * Reason reported when this stage leaves no candidate.
     */
    default DenyReason denyReason() {
        return DenyReason.NO_ELIGIBLE_MODEL;
    }
}
