package org.lime.foodrecommender.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lime.foodrecommender.ai.FallbackClassifier;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayRequest;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DialogueManagerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private LanguageModelGateway gateway;

    private DialogueManager dialogueManager;
    private SessionMemory memory;

    @BeforeEach
    void setUp() {
        FoodRecommenderProperties properties = new FoodRecommenderProperties();
        dialogueManager = new DialogueManager(
                gateway,
                new FallbackClassifier(properties),
                new SlotSchema(properties),
                new SufficiencyPolicy(properties),
                mapper,
                properties);
        memory = new SessionMemory("user-1", "general", 3);
    }

    private void modelAnswers(Map<GatewayTask, String> payloads) {
        when(gateway.call(any())).thenAnswer(invocation -> {
            GatewayRequest request = invocation.getArgument(0);
            String payload = payloads.get(request.task());
            if (payload == null) {
                throw new GatewayException(request.task(), "unavailable", true);
            }
            return json(payload);
        });
    }

    private JsonNode json(String payload) throws Exception {
        return mapper.readTree(payload);
    }

    @Test
    @DisplayName("an intent outside the enumeration falls back to the rules")
    void invalidModelIntentUsesFallback() {
        modelAnswers(Map.of(GatewayTask.INTENT, "{\"intent\": \"order_food\", \"confidence\": 0.99}"));

        DialogueOutcome outcome = dialogueManager.processTurn("Show me spicy veg biryani under 300", memory);

        assertThat(outcome.intent()).isEqualTo(Intent.REQUEST_RECOMMENDATION);
        assertThat(memory.getMetrics().getFallbackClassifications()).isEqualTo(1);
        assertThat(memory.getTurns()).extracting(Turn::detectedIntent).containsExactly(Intent.REQUEST_RECOMMENDATION);
    }

    @Test
    void unreachableModelStillExtractsAndDecides() {
        modelAnswers(Map.of());

        DialogueOutcome outcome = dialogueManager.processTurn("Show me spicy veg biryani under 300", memory);

        assertThat(outcome.sufficient()).isTrue();
        assertThat(outcome.slots().asMap()).containsOnly(
                Map.entry("dietary", "veg"),
                Map.entry("dish", "biryani"),
                Map.entry("price_max", 300),
                Map.entry("spice", "high"));
        assertThat(memory.getPendingClarifications()).isEmpty();
    }

    @Test
    void lowConfidenceIsTreatedAsFailure() {
        modelAnswers(Map.of(GatewayTask.INTENT, "{\"intent\": \"goodbye\", \"confidence\": 0.2}"));

        DialogueOutcome outcome = dialogueManager.processTurn("hello!", memory);

        assertThat(outcome.intent()).isEqualTo(Intent.GREETING);
    }

    @Test
    void modelSlotsAreValidatedAndHeuristicsFillGaps() {
        modelAnswers(Map.of(
                GatewayTask.INTENT, "{\"intent\": \"specify_preference\", \"confidence\": 0.9}",
                GatewayTask.SLOT_EXTRACT, "{\"slots\": {\"dish\": \"dosa\", \"price_max\": 99999, \"dietary\": null}, \"new_query\": false}"));

        DialogueOutcome outcome = dialogueManager.processTurn("a veg dosa, money no issue up to 99999", memory);

        assertThat(outcome.slots().getString("dish")).isEqualTo("dosa");
        assertThat(outcome.slots().getString("dietary")).isEqualTo("veg");
        assertThat(outcome.slots().has("price_max")).isFalse();
        assertThat(outcome.discardedSlots()).containsExactly("price_max");
        assertThat(outcome.sufficient()).isFalse();
        assertThat(outcome.missingRequirement()).isEqualTo("price");
        assertThat(memory.getPendingClarifications()).containsExactly("price_max", "no_price_limit");
    }

    @Test
    void newQueryClearsPreviousSlots() {
        memory.getSlots().put("dish", "pizza");
        memory.getSlots().put("price_max", 500);
        modelAnswers(Map.of(
                GatewayTask.INTENT, "{\"intent\": \"request_recommendation\", \"confidence\": 0.9}",
                GatewayTask.SLOT_EXTRACT, "{\"slots\": {\"cuisine\": [\"thai\"]}, \"new_query\": true}"));

        DialogueOutcome outcome = dialogueManager.processTurn("forget that, what about thai", memory);

        assertThat(outcome.slots().has("dish")).isFalse();
        assertThat(outcome.slots().has("price_max")).isFalse();
        assertThat(outcome.slots().getSet("cuisine")).containsExactly("thai");
    }

    @Test
    void greetingDoesNotExtractSlots() {
        modelAnswers(Map.of(GatewayTask.INTENT, "{\"intent\": \"greeting\", \"confidence\": 0.95}"));

        DialogueOutcome outcome = dialogueManager.processTurn("hey there, under 300 please", memory);

        assertThat(outcome.intent()).isEqualTo(Intent.GREETING);
        assertThat(outcome.slots().isEmpty()).isTrue();
        assertThat(outcome.sufficient()).isFalse();
        verify(gateway, never()).call(argThat(request -> request.task() == GatewayTask.SLOT_EXTRACT));
    }

    @Test
    void modelSeesRecentHistory() {
        modelAnswers(Map.of());
        memory.recordTurn(Turn.system("What are you in the mood for?"));

        dialogueManager.processTurn("biryani", memory);

        verify(gateway).call(argThat(request -> request.task() == GatewayTask.INTENT
                && request.context().contains("system: What are you in the mood for?")));
        assertThat(memory.getTurns()).hasSize(2);
    }
}
