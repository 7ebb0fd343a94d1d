package org.lime.foodrecommender.rerank;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayRequest;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.SlotSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.lime.foodrecommender.conversation.SlotSet.*;

/**
 * Builds the working set of ranking conditions for one recommendation cycle: the baseline rules,
 * the contextual rules implied by slots and recent history, then persona weighting and
 * normalization so the weights sum to one.
 */
@Slf4j
@Component
public class ConditionGenerator {

    static final int MAX_DESCRIPTION_LENGTH = 160;
    private static final double DEFAULT_WEIGHT = 0.1;

    private final LanguageModelGateway gateway;
    private final Map<String, Double> weights;
    private final Map<String, Map<String, Double>> personaMultipliers;
    private final boolean generative;

    public ConditionGenerator(LanguageModelGateway gateway, FoodRecommenderProperties properties) {
        this.gateway = gateway;
        this.weights = Map.copyOf(properties.getRerank().getWeights());
        this.personaMultipliers = Map.copyOf(properties.getRerank().getPersonaMultipliers());
        this.generative = properties.getRerank().isGenerativeConditions();
    }

    public List<RankingCondition> generate(SlotSet slots, Set<String> recentCuisines, String persona) {
        List<RankingCondition> conditions = new ArrayList<>();
        conditions.add(condition(ConditionEvaluator.SIMILARITY, null));
        conditions.add(condition(ConditionEvaluator.PRICE_FIT, null));
        conditions.add(condition(ConditionEvaluator.DIETARY_MATCH, slots.getString(DIETARY)));
        conditions.add(condition(ConditionEvaluator.RATING, null));

        if (!recentCuisines.isEmpty()) {
            conditions.add(condition(ConditionEvaluator.CUISINE_DIVERSITY, null));
        }
        if (slots.has(SPICE)) {
            conditions.add(condition(ConditionEvaluator.SPICE_MATCH, slots.getString(SPICE)));
        }
        if (slots.has(LABEL)) {
            conditions.add(condition(ConditionEvaluator.LABEL_MATCH, slots.getString(LABEL)));
        }
        if (slots.has(DISH)) {
            conditions.add(condition(ConditionEvaluator.NAME_MATCH, slots.getString(DISH)));
        }
        if (generative) {
            conditions.addAll(generated(slots, recentCuisines, persona, conditions));
        }
        return normalize(applyPersona(conditions, persona));
    }

    private RankingCondition condition(ConditionEvaluator evaluator, String argument) {
        String name = evaluator.getWireName();
        return new RankingCondition(name, weights.getOrDefault(name, DEFAULT_WEIGHT), evaluator, argument,
                "Rewards " + evaluator.getPhrase());
    }

    private List<RankingCondition> generated(SlotSet slots,
                                             Set<String> recentCuisines,
                                             String persona,
                                             List<RankingCondition> existing) {
        List<String> context = new ArrayList<>();
        context.add("persona: " + persona);
        context.add("recently shown cuisines: " + (recentCuisines.isEmpty() ? "none" : String.join(", ", recentCuisines)));
        slots.asMap().forEach((slot, value) -> context.add(slot + ": " + value));
        JsonNode payload;
        try {
            payload = gateway.call(new GatewayRequest(GatewayTask.CONDITIONS, "rank dishes for this user", context));
        } catch (GatewayException e) {
            log.warn("Condition generation unavailable, keeping rule-based conditions: {}", e.getMessage());
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        existing.forEach(condition -> names.add(condition.name()));
        List<RankingCondition> accepted = new ArrayList<>();
        for (JsonNode node : payload.path("conditions")) {
            Optional<RankingCondition> parsed = parse(node);
            if (parsed.isEmpty() || !names.add(parsed.get().name())) {
                log.info("Dropping generated condition {}", node);
                continue;
            }
            accepted.add(parsed.get());
        }
        return accepted;
    }

    static Optional<RankingCondition> parse(JsonNode node) {
        String name = node.path("name").asText("").trim();
        Optional<ConditionEvaluator> evaluator = ConditionEvaluator.fromWire(node.path("evaluator").asText(null));
        JsonNode weight = node.path("weight");
        String description = node.path("description").asText("").trim();
        if (name.isEmpty() || evaluator.isEmpty() || !weight.isNumber()) {
            return Optional.empty();
        }
        double w = weight.asDouble();
        if (!(w > 0.0 && w <= 1.0) || description.isEmpty() || description.length() > MAX_DESCRIPTION_LENGTH) {
            return Optional.empty();
        }
        String argument = node.hasNonNull("argument") ? node.get("argument").asText() : null;
        return Optional.of(new RankingCondition(name, w, evaluator.get(), argument, description));
    }

    private List<RankingCondition> applyPersona(List<RankingCondition> conditions, String persona) {
        Map<String, Double> multipliers = persona == null ? null : personaMultipliers.get(persona);
        if (multipliers == null || multipliers.isEmpty()) {
            return conditions;
        }
        List<RankingCondition> weighted = new ArrayList<>(conditions.size());
        for (RankingCondition condition : conditions) {
            double multiplier = multipliers.getOrDefault(condition.name(), 1.0);
            weighted.add(multiplier > 0 ? condition.withWeight(condition.weight() * multiplier) : condition);
        }
        return weighted;
    }

    private static List<RankingCondition> normalize(List<RankingCondition> conditions) {
        double total = conditions.stream().mapToDouble(RankingCondition::weight).sum();
        if (total <= 0) {
            double even = 1.0 / conditions.size();
            return conditions.stream().map(condition -> condition.withWeight(even)).toList();
        }
        return conditions.stream().map(condition -> condition.withWeight(condition.weight() / total)).toList();
    }
}
