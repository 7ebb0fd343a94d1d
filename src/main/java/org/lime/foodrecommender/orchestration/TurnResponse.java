package org.lime.foodrecommender.orchestration;

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Builder
public record TurnResponse(
        String sessionId,
        Status status,
        String intent,
        String message,
        @Singular("item") List<RecommendationItem> items,
        List<ConditionSummary> conditions,
        List<String> missingSlots,
        boolean degraded,
        Set<Integer> failedShards,
        Map<String, Object> slots,
        Map<String, Object> metrics
) {

    public enum Status {
        GREETING,
        COLLECTING,
        RECOMMENDED,
        NO_MATCH,
        RETRY,
        UNCLEAR,
        ENDED
    }

    public record RecommendationItem(int rank,
                                     String itemId,
                                     String name,
                                     String restaurant,
                                     Double price,
                                     Double rating,
                                     String dietary,
                                     List<String> cuisines,
                                     double score,
                                     String explanation) {
    }

    public record ConditionSummary(String name, double weight, String description) {
    }
}
