package org.lime.foodrecommender.orchestration;

import org.lime.foodrecommender.conversation.SearchRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SearchHistoryEntry(int index,
                                 Instant timestamp,
                                 String query,
                                 Map<String, Object> filters,
                                 List<String> conditions,
                                 List<String> itemIds,
                                 int resultCount,
                                 boolean degraded,
                                 String preview) {

    static SearchHistoryEntry from(SearchRecord record) {
        int count = record.itemIds().size();
        return new SearchHistoryEntry(
                record.sequence(),
                record.timestamp(),
                record.query(),
                record.filters(),
                record.conditions(),
                record.itemIds(),
                count,
                record.degraded(),
                "Found " + count + " recommendation" + (count == 1 ? "" : "s") + " for '" + record.query() + "'");
    }
}
