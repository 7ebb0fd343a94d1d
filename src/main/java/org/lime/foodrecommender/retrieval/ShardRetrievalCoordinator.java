package org.lime.foodrecommender.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one query out to every shard and reduces the answers into a single candidate list.
 * A shard that misses its deadline is cancelled with interruption so its worker is released;
 * the other shards keep running.
 */
@Slf4j
@Service
public class ShardRetrievalCoordinator {

    private final ShardSearchClient client;
    private final ExecutorService executor;
    private final Duration shardTimeout;
    private final Duration turnTimeout;

    public ShardRetrievalCoordinator(ShardSearchClient client,
                                     @Qualifier("shardSearchExecutor") ExecutorService executor,
                                     FoodRecommenderProperties properties) {
        this.client = client;
        this.executor = executor;
        this.shardTimeout = properties.getRetrieval().getShardTimeout();
        this.turnTimeout = properties.getRetrieval().getTurnTimeout();
    }

    public RetrievalResult retrieve(Query query, List<Integer> shardIds, int topNPerShard, int cap) {
        if (shardIds.isEmpty()) {
            return new RetrievalResult(List.of(), Set.of());
        }
        long submittedAt = System.nanoTime();
        long turnDeadline = submittedAt + turnTimeout.toNanos();
        long shardDeadline = Math.min(submittedAt + shardTimeout.toNanos(), turnDeadline);

        Map<Integer, Future<List<ShardHit>>> units = new LinkedHashMap<>();
        for (Integer shardId : new TreeSet<>(shardIds)) {
            units.put(shardId, executor.submit(() -> client.search(shardId, query.semanticText(), query.filters(), topNPerShard)));
        }

        Map<Integer, List<ShardHit>> answered = new TreeMap<>();
        Set<Integer> failed = new TreeSet<>();
        units.forEach((shardId, unit) -> {
            try {
                List<ShardHit> hits = unit.get(Math.max(0, shardDeadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                answered.put(shardId, hits == null ? List.of() : hits);
            } catch (TimeoutException e) {
                unit.cancel(true);
                failed.add(shardId);
                log.warn("Shard {} timed out, worker interrupted", shardId);
            } catch (ExecutionException e) {
                failed.add(shardId);
                log.warn("Shard {} contributed no candidates: {}", shardId, e.getCause().toString());
            } catch (CancellationException e) {
                failed.add(shardId);
                log.warn("Shard {} was cancelled", shardId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                unit.cancel(true);
                failed.add(shardId);
            }
        });
        if (answered.isEmpty()) {
            throw new TotalRetrievalFailureException(failed);
        }
        return new RetrievalResult(merge(answered, cap), failed);
    }

    /**
     * Union of all shard answers, unique by item id with the highest similarity kept (lower shard id
     * on ties), ordered by similarity descending then item id, truncated to {@code cap}.
     */
    static List<CandidateItem> merge(Map<Integer, List<ShardHit>> answered, int cap) {
        Map<String, CandidateItem> best = new LinkedHashMap<>();
        new TreeMap<>(answered).forEach((shardId, hits) -> {
            for (ShardHit hit : hits) {
                CandidateItem existing = best.get(hit.itemId());
                if (existing == null || hit.similarity() > existing.similarityScore()) {
                    best.put(hit.itemId(), new CandidateItem(hit.itemId(), hit.similarity(), shardId, hit.metadata()));
                }
            }
        });
        List<CandidateItem> merged = new ArrayList<>(best.values());
        merged.sort(Comparator.comparingDouble(CandidateItem::similarityScore).reversed()
                .thenComparing(CandidateItem::itemId));
        return merged.size() > cap ? List.copyOf(merged.subList(0, Math.max(0, cap))) : merged;
    }
}
