package org.lime.foodrecommender.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.menu.MenuItem;
import org.lime.foodrecommender.menu.MenuItemRepository;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.lime.foodrecommender.menu.MenuItemSpec.inShard;
import static org.lime.foodrecommender.menu.MenuItemSpec.matching;

/**
 * Scores the filtered rows of one shard by cosine similarity between the query text and the
 * item text embeddings. Both vector caches are bounded.
 */
@Service
public class EmbeddingShardSearchClient implements ShardSearchClient {

    private final MenuItemRepository repository;
    private final EmbeddingModel embeddingModel;
    private final Cache<Long, float[]> itemEmbeddingCache;
    private final Cache<String, float[]> queryEmbeddingCache;

    public EmbeddingShardSearchClient(MenuItemRepository repository,
                                      EmbeddingModel embeddingModel,
                                      FoodRecommenderProperties properties) {
        this.repository = repository;
        this.embeddingModel = embeddingModel;
        FoodRecommenderProperties.Cache cache = properties.getCache();
        this.itemEmbeddingCache = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(cache.getItemEmbeddingMaxSize())
                .expireAfterWrite(cache.getExpireAfterWrite())
                .build();
        this.queryEmbeddingCache = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(cache.getQueryEmbeddingMaxSize())
                .expireAfterWrite(cache.getExpireAfterWrite())
                .build();
    }

    @Override
    public List<ShardHit> search(int shardId, String semanticText, Map<String, FilterConstraint> filters, int topN) {
        List<MenuItem> rows = repository.findAll(inShard(shardId).and(matching(filters)));
        if (rows.isEmpty()) {
            return List.of();
        }
        float[] queryVec = queryEmbeddingCache.get(semanticText, text -> embeddingModel.embed(text));

        record Scored(MenuItem item, double score) {
        }

        List<Scored> scored = new ArrayList<>(rows.size());
        for (MenuItem item : rows) {
            scored.add(new Scored(item, cosine(queryVec, embeddingForItem(item))));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        int limit = Math.min(Math.max(0, topN), scored.size());
        List<ShardHit> hits = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Scored s = scored.get(i);
            hits.add(new ShardHit(s.item().itemId(), s.score(), s.item().toMetadata()));
        }
        return hits;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double na = 0;
        double nb = 0;
        int length = Math.min(a.length, b.length);
        for (int i = 0; i < length; i++) {
            float x = a[i];
            float y = b[i];
            dot += x * y;
            na += x * x;
            nb += y * y;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb) + 1e-9);
    }

    private float[] embeddingForItem(MenuItem item) {
        Long id = item.getId();
        if (id == null) {
            return embeddingModel.embed(itemText(item));
        }
        return itemEmbeddingCache.get(id, key -> embeddingModel.embed(itemText(item)));
    }

    long cachedQueryEmbeddings() {
        queryEmbeddingCache.cleanUp();
        return queryEmbeddingCache.estimatedSize();
    }

    static String itemText(MenuItem item) {
        StringBuilder sb = new StringBuilder();
        appendToken(sb, item.getName());
        appendToken(sb, item.getCuisine());
        appendToken(sb, item.getSecondaryCuisine());
        appendToken(sb, item.getDietary());
        if ("high".equals(item.getSpiceLevel())) {
            appendToken(sb, "spicy");
        }
        appendToken(sb, item.getLabel());
        appendToken(sb, item.getDescription());
        return sb.toString().trim();
    }

    private static void appendToken(StringBuilder sb, String token) {
        if (token == null) {
            return;
        }
        String trimmed = token.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(trimmed);
    }
}
