package org.lime.foodrecommender.rerank;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.RecommendationCycle;
import org.lime.foodrecommender.conversation.SessionMemory;
import org.lime.foodrecommender.conversation.SlotSet;
import org.lime.foodrecommender.retrieval.CandidateItem;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.lime.foodrecommender.conversation.SlotSet.*;

/**
 * Scores candidates against the cycle's conditions and keeps the best {@code topK}.
 * Ordering is total: final score, then similarity, then item id.
 */
@Slf4j
@Service
public class RerankingEngine {

    static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::finalScore).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredCandidate s) -> s.item().similarityScore()).reversed())
            .thenComparing(s -> s.item().itemId());

    private final ConditionGenerator conditionGenerator;
    private final ExplanationService explanationService;
    private final int topK;

    public RerankingEngine(ConditionGenerator conditionGenerator,
                           ExplanationService explanationService,
                           FoodRecommenderProperties properties) {
        this.conditionGenerator = conditionGenerator;
        this.explanationService = explanationService;
        this.topK = Math.max(1, Math.min(10, properties.getRerank().getTopK()));
    }

    public RerankOutcome rerank(List<CandidateItem> candidates, SessionMemory memory, String persona) {
        SlotSet slots = memory.getSlots();
        Set<String> recentCuisines = new LinkedHashSet<>();
        memory.recentlyShownCuisines().forEach(c -> recentCuisines.add(c.toLowerCase(Locale.ROOT)));
        List<RankingCondition> conditions = conditionGenerator.generate(slots, recentCuisines, persona);
        if (candidates.isEmpty()) {
            return new RerankOutcome(List.of(), List.of(), conditions);
        }

        ScoringContext context = new ScoringContext(
                slots.getInteger(PRICE_MIN),
                slots.has(NO_PRICE_LIMIT) ? null : slots.getInteger(PRICE_MAX),
                recentCuisines
        );
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (CandidateItem candidate : candidates) {
            scored.add(score(candidate, conditions, context));
        }
        scored.sort(RANKING);
        List<ScoredCandidate> selected = List.copyOf(scored.subList(0, Math.min(topK, scored.size())));

        Map<String, String> explanations = explanationService.explain(selected, conditions, requestSummary(slots));
        List<RankedResult> results = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            ScoredCandidate s = selected.get(i);
            String explanation = explanations.get(s.item().itemId());
            if (explanation == null || explanation.isBlank()) {
                explanation = ExplanationService.template(s, Map.of());
            }
            results.add(new RankedResult(s.item().itemId(), s.finalScore(), explanation, i + 1));
        }

        Set<String> shownCuisines = new LinkedHashSet<>();
        selected.forEach(s -> s.item().cuisines().forEach(c -> shownCuisines.add(c.toLowerCase(Locale.ROOT))));
        memory.recordRecommendation(new RecommendationCycle(
                results.stream().map(RankedResult::itemId).toList(), shownCuisines, Instant.now()));
        log.debug("Ranked {} of {} candidates with {} conditions", results.size(), candidates.size(), conditions.size());
        return new RerankOutcome(results, selected, conditions);
    }

    static ScoredCandidate score(CandidateItem candidate, List<RankingCondition> conditions, ScoringContext context) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        double total = 0.0;
        for (RankingCondition condition : conditions) {
            double contribution = condition.weight() * condition.score(candidate, context);
            contributions.merge(condition.name(), contribution, Double::sum);
            total += contribution;
        }
        return new ScoredCandidate(candidate, total, contributions);
    }

    private static String requestSummary(SlotSet slots) {
        List<String> parts = new ArrayList<>();
        slots.asMap().forEach((slot, value) -> parts.add(slot + "=" + value));
        return parts.isEmpty() ? "anything good" : String.join(", ", parts);
    }
}
