package org.lime.foodrecommender.retrieval;

import java.util.Set;

public class TotalRetrievalFailureException extends RuntimeException {

    private final Set<Integer> failedShards;

    public TotalRetrievalFailureException(Set<Integer> failedShards) {
        super("All shards failed: " + failedShards);
        this.failedShards = Set.copyOf(failedShards);
    }

    public Set<Integer> getFailedShards() {
        return failedShards;
    }
}
