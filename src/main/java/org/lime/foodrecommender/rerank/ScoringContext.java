package org.lime.foodrecommender.rerank;

import java.util.Set;

public record ScoringContext(Integer priceMin, Integer priceMax, Set<String> recentCuisines) {

    public ScoringContext {
        recentCuisines = recentCuisines == null ? Set.of() : Set.copyOf(recentCuisines);
    }
}
