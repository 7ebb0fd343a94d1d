package org.lime.foodrecommender.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SearchRecord(int sequence,
                           String query,
                           Map<String, Object> filters,
                           List<String> conditions,
                           List<String> itemIds,
                           boolean degraded,
                           Instant timestamp) {

    public SearchRecord {
        filters = Map.copyOf(filters);
        conditions = List.copyOf(conditions);
        itemIds = List.copyOf(itemIds);
    }
}
