package com.vcc.router.service.selection;

import com.vcc.router.model.Candidate;

import java.util.ArrayList;
import java.util.List;

/**
 * Recommended candidate plus the ordered fallback chain for one request.
 */
public record Selection(Candidate recommended, List<Candidate> fallbackChain) {

    public Selection {
        fallbackChain = List.copyOf(fallbackChain);
    }

    /**
     * Recommended first, then the fallback chain.
     */
    public List<Candidate> plan() {
        List<Candidate> plan = new ArrayList<>(fallbackChain.size() + 1);
        plan.add(recommended);
        plan.addAll(fallbackChain);
        return plan;
    }

    public List<String> fallbackModelIds() {
        return fallbackChain.stream().map(Candidate::modelId).toList();
    }
}
