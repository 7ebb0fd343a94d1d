package org.lime.foodrecommender.menu;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class CatalogService {

    private final MenuItemRepository repository;
    private final Cache<String, Map<String, Object>> metadataCache;
    private final AtomicReference<List<Integer>> shardCache = new AtomicReference<>();

    public CatalogService(MenuItemRepository repository, FoodRecommenderProperties properties) {
        this.repository = repository;
        this.metadataCache = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(properties.getCache().getMetadataMaxSize())
                .expireAfterWrite(properties.getCache().getExpireAfterWrite())
                .build();
    }

    public Optional<Map<String, Object>> metadataFor(String itemId) {
        Map<String, Object> cached = metadataCache.getIfPresent(itemId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Long id;
        try {
            id = Long.valueOf(itemId);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return repository.findById(id)
                .map(MenuItem::toMetadata)
                .map(metadata -> {
                    metadataCache.put(itemId, metadata);
                    return metadata;
                });
    }

    public List<Integer> shardIds() {
        List<Integer> cached = shardCache.get();
        if (cached != null) {
            return cached;
        }
        List<Integer> loaded = List.copyOf(repository.findDistinctShards());
        if (shardCache.compareAndSet(null, loaded)) {
            return loaded;
        }
        return shardCache.get();
    }
}
