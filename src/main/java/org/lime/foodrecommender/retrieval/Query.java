package org.lime.foodrecommender.retrieval;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record Query(String semanticText, SortedMap<String, FilterConstraint> filters) {

    public Query {
        filters = Collections.unmodifiableSortedMap(new TreeMap<>(filters));
    }
}
