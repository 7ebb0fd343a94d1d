package org.lime.foodrecommender.retrieval;

import java.util.List;
import java.util.Set;

public record RetrievalResult(List<CandidateItem> candidates, Set<Integer> failedShards) {

    public RetrievalResult {
        candidates = List.copyOf(candidates);
        failedShards = Set.copyOf(failedShards);
    }

    public boolean degraded() {
        return !failedShards.isEmpty();
    }
}
