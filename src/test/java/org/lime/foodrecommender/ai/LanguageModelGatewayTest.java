package org.lime.foodrecommender.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.config.ResilienceConfig;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LanguageModelGatewayTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final AtomicInteger calls = new AtomicInteger();
    private final ResilienceConfig resilience = new ResilienceConfig();
    private FoodRecommenderProperties properties;
    private ExecutorService executor;
    private LanguageModelGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new FoodRecommenderProperties();
        properties.getGateway().setTimeout(Duration.ofMillis(200));
        properties.getGateway().setMaxAttempts(2);
        properties.getGateway().setRetryBackoff(Duration.ofMillis(10));
        executor = Executors.newCachedThreadPool();
        gateway = gateway();
    }

    private LanguageModelGateway gateway() {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);
        return new LanguageModelGateway(builder, new ObjectMapper(), executor,
                resilience.gatewayTimeLimiter(properties),
                resilience.gatewayRetry(properties),
                resilience.gatewayRateLimiter(properties));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void reply(String... responses) {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenAnswer(invocation -> {
            int call = calls.getAndIncrement();
            String response = responses[Math.min(call, responses.length - 1)];
            if (response == null) {
                throw new IllegalStateException("connection reset");
            }
            if (response.equals("SLOW")) {
                Thread.sleep(1_000);
            }
            return response;
        });
    }

    @Test
    void parsesFencedJsonForIntent() {
        reply("```json\n{\"intent\": \"greeting\", \"confidence\": 0.92}\n```");

        JsonNode node = gateway.call(new GatewayRequest(GatewayTask.INTENT, "hi", List.of("system: hello")));

        assertThat(node.path("intent").asText()).isEqualTo("greeting");
        assertThat(node.path("confidence").asDouble()).isEqualTo(0.92);
    }

    @Test
    void schemaViolationIsNotRetried() {
        reply("{\"label\": \"greeting\"}");

        assertThatThrownBy(() -> gateway.call(GatewayRequest.of(GatewayTask.INTENT, "hi")))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).isRetryable()).isFalse());
        assertThat(calls).hasValue(1);
    }

    @Test
    void proseWithoutJsonIsAFailure() {
        reply("I think the user is greeting you.");

        assertThatThrownBy(() -> gateway.call(GatewayRequest.of(GatewayTask.INTENT, "hi")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void transportFailureIsRetried() {
        reply(null, "{\"slots\": {\"dish\": \"dosa\"}, \"new_query\": false}");

        JsonNode node = gateway.call(GatewayRequest.of(GatewayTask.SLOT_EXTRACT, "dosa please"));

        assertThat(node.path("slots").path("dish").asText()).isEqualTo("dosa");
        assertThat(calls).hasValue(2);
    }

    @Test
    void lateResponsesFailAfterAllAttempts() {
        reply("SLOW");

        assertThatThrownBy(() -> gateway.call(GatewayRequest.of(GatewayTask.EXPLAIN, "why")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("no response within");
        assertThat(calls).hasValue(2);
    }

    @Test
    void explanationPayloadMustCarryObject() {
        reply("{\"explanations\": [\"not an object\"]}");

        assertThatThrownBy(() -> gateway.call(GatewayRequest.of(GatewayTask.EXPLAIN, "why")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("EXPLAIN");
    }

    @Test
    void callsOverTheRateLimitFailWithoutReachingTheModel() {
        properties.getGateway().getRateLimit().setLimitForPeriod(2);
        properties.getGateway().getRateLimit().setRefreshPeriod(Duration.ofMinutes(1));
        properties.getGateway().getRateLimit().setPermitWait(Duration.ZERO);
        gateway = gateway();
        reply("{\"intent\": \"greeting\", \"confidence\": 0.9}");

        gateway.call(GatewayRequest.of(GatewayTask.INTENT, "hi"));
        gateway.call(GatewayRequest.of(GatewayTask.INTENT, "hello"));

        assertThatThrownBy(() -> gateway.call(GatewayRequest.of(GatewayTask.INTENT, "hey")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("rate limit")
                .satisfies(e -> assertThat(((GatewayException) e).isRetryable()).isFalse());
        assertThat(calls).hasValue(2);
    }
}
