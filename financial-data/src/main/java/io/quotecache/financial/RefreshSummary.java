package io.quotecache.financial;

import io.quotecache.core.RefreshOutcome;

import java.util.Map;

public record RefreshSummary(String sourceId, Map<RefreshOutcome, Integer> outcomes, int failed) {
    public RefreshSummary {
        outcomes = Map.copyOf(outcomes);
    }

    public int count(RefreshOutcome outcome) { return outcomes.getOrDefault(outcome, 0); }
}
