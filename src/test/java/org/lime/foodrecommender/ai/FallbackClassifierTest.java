package org.lime.foodrecommender.ai;

import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.Intent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackClassifierTest {

    private FallbackClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new FallbackClassifier(new FoodRecommenderProperties());
    }

    @Test
    @DisplayName("spicy veg biryani request yields dish, dietary, budget and spice")
    void extractsScenarioSlots() {
        Map<String, Object> slots = classifier.extractSlots("Show me spicy veg biryani under 300");

        assertThat(slots).containsOnly(
                Map.entry("dietary", "veg"),
                Map.entry("dish", "biryani"),
                Map.entry("price_max", 300),
                Map.entry("spice", "high"));
        assertThat(classifier.classify("Show me spicy veg biryani under 300", false))
                .isEqualTo(Intent.REQUEST_RECOMMENDATION);
    }

    @Test
    void extractsPriceRangeCuisinesAndNonVeg() {
        Map<String, Object> slots = classifier.extractSlots("non-veg chinese or thai food between 200 and 600");

        assertThat(slots)
                .containsEntry("dietary", "nonveg")
                .containsEntry("cuisine", List.of("chinese", "thai"))
                .containsEntry("price_min", 200)
                .containsEntry("price_max", 600);
    }

    @Test
    void recognisesNoPriceLimit() {
        Map<String, Object> slots = classifier.extractSlots("no budget, any pizza is fine");

        assertThat(slots)
                .containsEntry("no_price_limit", Boolean.TRUE)
                .containsEntry("dish", "pizza")
                .doesNotContainKey("price_max");
    }

    @Test
    void lowerBoundSuppressesBareAmount() {
        Map<String, Object> slots = classifier.extractSlots("paneer above 200, nothing like ₹500 though");

        assertThat(slots)
                .containsEntry("price_min", 200)
                .doesNotContainKey("price_max");
    }

    @Test
    void separateLowerAndUpperBounds() {
        assertThat(classifier.extractSlots("thali over 150 and under 400"))
                .containsEntry("price_min", 150)
                .containsEntry("price_max", 400);
    }

    @Test
    void mildWinsOverSpicyWhenNegated() {
        assertThat(classifier.extractSlots("something not spicy for lunch"))
                .containsEntry("spice", "mild")
                .containsEntry("meal_type", "lunch");
    }

    @Test
    void firstMatchingRuleWins() {
        assertThat(classifier.classify("actually make it under 500", false)).isEqualTo(Intent.UPDATE_PREFERENCE);
        assertThat(classifier.classify("hello there", false)).isEqualTo(Intent.GREETING);
        assertThat(classifier.classify("thanks, bye", false)).isEqualTo(Intent.GOODBYE);
        assertThat(classifier.classify("qwerty zxcv", false)).isEqualTo(Intent.UNKNOWN);
        assertThat(classifier.classify("", false)).isEqualTo(Intent.UNKNOWN);
    }

    @Test
    void pendingQuestionTurnsSlotAnswerIntoClarification() {
        assertThat(classifier.classify("under 300", true)).isEqualTo(Intent.CLARIFICATION_RESPONSE);
        assertThat(classifier.classify("under 300", false)).isEqualTo(Intent.SPECIFY_PREFERENCE);
    }
}
