package org.lime.foodrecommender.retrieval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ShardHit(String itemId, double similarity, Map<String, Object> metadata) {

    public ShardHit {
        Map<String, Object> copy = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        copy.values().removeIf(Objects::isNull);
        metadata = Map.copyOf(copy);
    }
}
