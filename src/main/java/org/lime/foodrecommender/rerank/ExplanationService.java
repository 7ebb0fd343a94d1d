package org.lime.foodrecommender.rerank;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayRequest;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.retrieval.CandidateItem;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ExplanationService {

    private static final int TOP_CONTRIBUTORS = 2;
    private static final int MAX_LENGTH = 160;

    private final LanguageModelGateway gateway;
    private final boolean generative;

    public ExplanationService(LanguageModelGateway gateway, FoodRecommenderProperties properties) {
        this.gateway = gateway;
        this.generative = properties.getRerank().isGenerativeExplanations();
    }

    public Map<String, String> explain(List<ScoredCandidate> selected,
                                       List<RankingCondition> conditions,
                                       String request) {
        Map<String, RankingCondition> byName = conditions.stream()
                .collect(Collectors.toMap(RankingCondition::name, c -> c, (a, b) -> a, LinkedHashMap::new));
        Map<String, String> explanations = new LinkedHashMap<>();
        for (ScoredCandidate scored : selected) {
            explanations.put(scored.item().itemId(), template(scored, byName));
        }
        if (generative && !selected.isEmpty()) {
            generated(selected, byName, request).forEach(explanations::put);
        }
        return explanations;
    }

    private Map<String, String> generated(List<ScoredCandidate> selected,
                                          Map<String, RankingCondition> byName,
                                          String request) {
        List<String> lines = new ArrayList<>(selected.size());
        for (ScoredCandidate scored : selected) {
            String reasons = scored.topContributors(TOP_CONTRIBUTORS).stream()
                    .map(name -> describe(name, byName))
                    .collect(Collectors.joining(", "));
            lines.add("%s | %s | %s".formatted(scored.item().itemId(), safe(scored.item().name()), reasons));
        }
        Map<String, String> accepted = new LinkedHashMap<>();
        try {
            JsonNode explanations = gateway.call(new GatewayRequest(GatewayTask.EXPLAIN, request, lines)).path("explanations");
            for (ScoredCandidate scored : selected) {
                String text = explanations.path(scored.item().itemId()).asText("").trim();
                if (!text.isEmpty() && text.length() <= MAX_LENGTH) {
                    accepted.put(scored.item().itemId(), text);
                }
            }
        } catch (GatewayException e) {
            log.warn("Explanation generation unavailable, using templates: {}", e.getMessage());
        }
        return accepted;
    }

    static String template(ScoredCandidate scored, Map<String, RankingCondition> byName) {
        List<String> reasons = scored.topContributors(TOP_CONTRIBUTORS).stream()
                .map(name -> describe(name, byName))
                .toList();
        String why = reasons.isEmpty() ? "overall fit" : String.join(" and ", reasons);
        String details = detailFragment(scored.item());
        return details == null
                ? "Picked for %s.".formatted(why)
                : "Picked for %s (%s).".formatted(why, details);
    }

    private static String describe(String name, Map<String, RankingCondition> byName) {
        RankingCondition condition = byName.get(name);
        if (condition == null) {
            return name.replace('_', ' ');
        }
        if (condition.evaluator().getWireName().equals(name)) {
            return condition.evaluator().getPhrase();
        }
        return condition.description();
    }

    private static String detailFragment(CandidateItem item) {
        List<String> notes = new ArrayList<>();
        Double price = item.price();
        if (price != null) {
            notes.add("₹" + String.format(Locale.ROOT, "%.0f", price));
        }
        Double rating = item.rating();
        if (rating != null) {
            notes.add("rated " + String.format(Locale.ROOT, "%.1f", rating));
        }
        String dietary = item.attribute("dietary");
        if (dietary != null) {
            notes.add(dietary.equals("nonveg") ? "non-veg" : dietary);
        }
        String joined = notes.stream().filter(Objects::nonNull).collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : joined;
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "unknown" : value.trim();
    }
}
