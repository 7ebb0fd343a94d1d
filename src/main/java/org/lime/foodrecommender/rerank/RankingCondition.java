package org.lime.foodrecommender.rerank;

import org.lime.foodrecommender.retrieval.CandidateItem;

public record RankingCondition(String name,
                               double weight,
                               ConditionEvaluator evaluator,
                               String argument,
                               String description) {

    public double score(CandidateItem item, ScoringContext context) {
        return evaluator.score(item, argument, context);
    }

    public RankingCondition withWeight(double newWeight) {
        return new RankingCondition(name, newWeight, evaluator, argument, description);
    }
}
