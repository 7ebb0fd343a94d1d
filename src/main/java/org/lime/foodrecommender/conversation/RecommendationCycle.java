package org.lime.foodrecommender.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record RecommendationCycle(List<String> itemIds, Set<String> cuisines, Instant recordedAt) {

    public RecommendationCycle {
        itemIds = List.copyOf(itemIds);
        cuisines = Set.copyOf(cuisines);
    }
}
