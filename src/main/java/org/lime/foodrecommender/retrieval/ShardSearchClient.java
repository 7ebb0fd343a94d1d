package org.lime.foodrecommender.retrieval;

import java.util.List;
import java.util.Map;

public interface ShardSearchClient {

    List<ShardHit> search(int shardId, String semanticText, Map<String, FilterConstraint> filters, int topN);
}
