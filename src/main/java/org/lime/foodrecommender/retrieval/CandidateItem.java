package org.lime.foodrecommender.retrieval;

import java.util.List;
import java.util.Map;

public record CandidateItem(String itemId, double similarityScore, int shardId, Map<String, Object> metadata) {

    public CandidateItem {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String name() {
        Object name = metadata.get("name");
        return name == null ? null : name.toString();
    }

    public Double price() {
        return metadata.get("price") instanceof Number n ? n.doubleValue() : null;
    }

    public Double rating() {
        return metadata.get("rating") instanceof Number n ? n.doubleValue() : null;
    }

    public String attribute(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    public List<String> cuisines() {
        Object value = metadata.get("cuisines");
        return value instanceof List<?> list ? list.stream().map(String::valueOf).toList() : List.of();
    }
}
