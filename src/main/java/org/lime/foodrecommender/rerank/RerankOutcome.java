package org.lime.foodrecommender.rerank;

import java.util.List;

public record RerankOutcome(List<RankedResult> results, List<ScoredCandidate> selected, List<RankingCondition> conditions) {

    public RerankOutcome {
        results = List.copyOf(results);
        selected = List.copyOf(selected);
        conditions = List.copyOf(conditions);
    }
}
