package org.lime.foodrecommender.rerank;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.SlotSet;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.lime.foodrecommender.conversation.SlotSet.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConditionGeneratorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private LanguageModelGateway gateway;

    private FoodRecommenderProperties properties;

    @BeforeEach
    void setUp() {
        properties = new FoodRecommenderProperties();
        properties.getRerank().getPersonaMultipliers().put("budget_conscious", Map.of("price_fit", 2.0));
    }

    private static double weightOf(List<RankingCondition> conditions, String name) {
        return conditions.stream().filter(c -> c.name().equals(name)).findFirst().orElseThrow().weight();
    }

    private static double sum(List<RankingCondition> conditions) {
        return conditions.stream().mapToDouble(RankingCondition::weight).sum();
    }

    @Test
    void baselineConditionsAreNormalized() {
        List<RankingCondition> conditions = new ConditionGenerator(gateway, properties)
                .generate(new SlotSet(), Set.of(), "general");

        assertThat(conditions).extracting(RankingCondition::name)
                .containsExactly("similarity", "price_fit", "dietary_match", "rating");
        assertThat(sum(conditions)).isCloseTo(1.0, within(1e-9));
        assertThat(weightOf(conditions, "similarity")).isCloseTo(0.35 / 0.85, within(1e-9));
        verifyNoInteractions(gateway);
    }

    @Test
    void slotsAndHistoryAddContextualConditions() {
        SlotSet slots = new SlotSet();
        slots.put(DIETARY, "veg");
        slots.put(SPICE, "high");
        slots.put(LABEL, "bestseller");
        slots.put(DISH, "biryani");

        List<RankingCondition> conditions = new ConditionGenerator(gateway, properties)
                .generate(slots, Set.of("hyderabadi"), "general");

        assertThat(conditions).extracting(RankingCondition::name).containsExactly(
                "similarity", "price_fit", "dietary_match", "rating",
                "cuisine_diversity", "spice_match", "label_match", "dish_name_match");
        assertThat(conditions).filteredOn(c -> c.name().equals("dish_name_match"))
                .extracting(RankingCondition::argument).containsExactly("biryani");
        assertThat(sum(conditions)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void personaMultipliersShiftWeightBeforeNormalizing() {
        ConditionGenerator generator = new ConditionGenerator(gateway, properties);

        List<RankingCondition> general = generator.generate(new SlotSet(), Set.of(), "general");
        List<RankingCondition> budget = generator.generate(new SlotSet(), Set.of(), "budget_conscious");

        assertThat(weightOf(budget, "price_fit")).isCloseTo(0.4 / 1.05, within(1e-9));
        assertThat(weightOf(budget, "price_fit")).isGreaterThan(weightOf(general, "price_fit"));
        assertThat(sum(budget)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void generatedConditionsAreValidatedAndDeduplicated() throws Exception {
        properties.getRerank().setGenerativeConditions(true);
        when(gateway.call(any())).thenReturn(mapper.readTree("""
                {"conditions": [
                  {"name": "crowd_favourite", "evaluator": "rating", "weight": 0.3, "description": "Popular with diners"},
                  {"name": "similarity", "evaluator": "similarity", "weight": 0.5, "description": "Duplicate name"},
                  {"name": "mystery", "evaluator": "horoscope", "weight": 0.2, "description": "Unknown rule"},
                  {"name": "zero", "evaluator": "rating", "weight": 0, "description": "No weight"},
                  {"name": "wordy", "evaluator": "rating", "weight": 0.2, "description": "%s"}
                ]}
                """.formatted("x".repeat(161))));

        List<RankingCondition> conditions = new ConditionGenerator(gateway, properties)
                .generate(new SlotSet(), Set.of(), "general");

        assertThat(conditions).extracting(RankingCondition::name)
                .containsExactly("similarity", "price_fit", "dietary_match", "rating", "crowd_favourite");
        assertThat(sum(conditions)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void unavailableModelKeepsRuleBasedConditions() {
        properties.getRerank().setGenerativeConditions(true);
        when(gateway.call(any())).thenThrow(new GatewayException(GatewayTask.CONDITIONS, "timed out", true));

        List<RankingCondition> conditions = new ConditionGenerator(gateway, properties)
                .generate(new SlotSet(), Set.of(), "general");

        assertThat(conditions).hasSize(4);
    }

    @Test
    void parseRejectsMissingDescription() throws Exception {
        assertThat(ConditionGenerator.parse(mapper.readTree(
                "{\"name\": \"n\", \"evaluator\": \"price_fit\", \"weight\": 0.5}"))).isEmpty();
        assertThat(ConditionGenerator.parse(mapper.readTree(
                "{\"name\": \"n\", \"evaluator\": \"PRICE_FIT\", \"weight\": 0.5, \"description\": \"cheap\"}")))
                .get().extracting(RankingCondition::evaluator).isEqualTo(ConditionEvaluator.PRICE_FIT);
    }
}
