package org.lime.foodrecommender.rerank;

import org.lime.foodrecommender.retrieval.CandidateItem;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

public record ScoredCandidate(CandidateItem item, double finalScore, Map<String, Double> contributions) {

    public ScoredCandidate {
        contributions = Map.copyOf(contributions);
    }

    /**
     * Names of the conditions that contributed most, largest first, ties by name.
     */
    public List<String> topContributors(int limit) {
        return contributions.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }
}
