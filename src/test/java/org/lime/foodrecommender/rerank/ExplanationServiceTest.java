package org.lime.foodrecommender.rerank;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.retrieval.CandidateItem;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExplanationServiceTest {

    private static final List<RankingCondition> CONDITIONS = List.of(
            new RankingCondition("similarity", 0.5, ConditionEvaluator.SIMILARITY, null, "Rewards closeness"),
            new RankingCondition("price_fit", 0.3, ConditionEvaluator.PRICE_FIT, null, "Rewards price"),
            new RankingCondition("crowd_favourite", 0.2, ConditionEvaluator.RATING, null, "popular with regulars"));

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private LanguageModelGateway gateway;

    private static ScoredCandidate scored(String id, double similarity, double price, double rating) {
        CandidateItem item = new CandidateItem(id, 0.9, 0, Map.of(
                "name", "Veg Dum Biryani",
                "price", price,
                "rating", rating,
                "dietary", "veg"));
        return new ScoredCandidate(item, 0.8, Map.of("similarity", similarity, "price_fit", 0.2, "crowd_favourite", 0.05));
    }

    private ExplanationService service(boolean generative) {
        FoodRecommenderProperties properties = new FoodRecommenderProperties();
        properties.getRerank().setGenerativeExplanations(generative);
        return new ExplanationService(gateway, properties);
    }

    @Test
    void templateNamesTopTwoConditionsAndItemDetails() {
        Map<String, String> explanations = service(false).explain(List.of(scored("1", 0.4, 249, 4.3)), CONDITIONS, "dish=biryani");

        assertThat(explanations).containsEntry("1",
                "Picked for closeness to what you asked for and price within your budget (₹249, rated 4.3, veg).");
    }

    @Test
    void generatedConditionUsesItsOwnDescription() {
        ScoredCandidate candidate = new ScoredCandidate(
                new CandidateItem("7", 0.5, 1, Map.of()), 0.5, Map.of("crowd_favourite", 0.3, "similarity", 0.1));

        String text = ExplanationService.template(candidate, Map.of("crowd_favourite", CONDITIONS.get(2)));

        assertThat(text).isEqualTo("Picked for popular with regulars and similarity.");
    }

    @Test
    void modelTextReplacesTemplatesItAnswers() throws Exception {
        when(gateway.call(any())).thenReturn(mapper.readTree("""
                {"explanations": {"1": "A fiery veg biryani well under your budget.", "2": "%s"}}
                """.formatted("y".repeat(200))));

        Map<String, String> explanations = service(true).explain(
                List.of(scored("1", 0.4, 249, 4.3), scored("2", 0.3, 199, 4.0)), CONDITIONS, "dish=biryani");

        assertThat(explanations).containsEntry("1", "A fiery veg biryani well under your budget.");
        assertThat(explanations.get("2")).startsWith("Picked for ");
    }

    @Test
    void modelFailureKeepsTemplates() {
        when(gateway.call(any())).thenThrow(new GatewayException(GatewayTask.EXPLAIN, "timed out", true));

        Map<String, String> explanations = service(true).explain(List.of(scored("1", 0.4, 249, 4.3)), CONDITIONS, "dish=biryani");

        assertThat(explanations.get("1")).startsWith("Picked for ");
    }
}
