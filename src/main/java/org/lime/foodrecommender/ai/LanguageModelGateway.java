package org.lime.foodrecommender.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single entry point for every language-model call. Replies must be a JSON object with the task's shape;
 * only transport failures and timeouts are retried.
 */
@Slf4j
@Service
public class LanguageModelGateway {

    private static final Map<GatewayTask, String> TEMPLATES = new EnumMap<>(GatewayTask.class);

    static {
        TEMPLATES.put(GatewayTask.INTENT, """
            You classify one message of a food-ordering conversation.

            Allowed intents: greeting, goodbye, specify_preference, update_preference,
            request_recommendation, clarification_response, unknown.

            Rules:
            - update_preference when the user changes something said before ("actually", "instead").
            - clarification_response when the user answers the assistant's last question.
            - request_recommendation when the user asks to be shown or suggested food.

            Recent conversation, oldest first:
            {context}

            Message: "{text}"

            Return ONLY a JSON object with the keys intent (one allowed value) and
            confidence (a number between 0 and 1).
            """);
        TEMPLATES.put(GatewayTask.SLOT_EXTRACT, """
            You extract food preferences from one user message.

            Known preferences so far:
            {context}

            Supported slots (omit any that are not mentioned):
            - dietary: veg, nonveg or vegan
            - cuisine: list of at most two cuisines
            - dish: dish name
            - price_max, price_min: integers in rupees
            - no_price_limit: true when the user says price does not matter
            - location: city or area
            - meal_type: breakfast, lunch, dinner or snacks
            - spice: mild, medium or high
            - label: bestseller, must try, chef's special, new, seasonal, dairy free, gluten free, eggless available

            Set new_query to true only when the user starts a completely new search that
            discards the known preferences; otherwise false.

            Message: "{text}"

            Return ONLY a JSON object with the keys slots (an object of slot values) and new_query.
            """);
        TEMPLATES.put(GatewayTask.EXPLAIN, """
            You write one short sentence per recommended dish explaining why it was picked.

            Each line below is one dish: item id, name, then the two criteria that mattered most.
            {context}

            User request: "{text}"

            Return ONLY a JSON object with the key explanations, mapping each item id
            (as a string) to its sentence. Keep each sentence under 160 characters.
            """);
        TEMPLATES.put(GatewayTask.CONDITIONS, """
            You propose extra ranking criteria for food recommendations.

            Available evaluators: similarity, price_fit, dietary_match, rating,
            cuisine_diversity, spice_match, label_match, dish_name_match.

            Context about the user:
            {context}

            Request: "{text}"

            Return ONLY a JSON object with the key conditions: a list where each entry has
            name, evaluator (one available value), weight (between 0 and 1) and description
            (under 160 characters).
            """);
    }

    private final ChatClient chatClient;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;
    private final Retry retry;
    private final RateLimiter rateLimiter;

    public LanguageModelGateway(ChatClient.Builder builder,
                                ObjectMapper mapper,
                                @Qualifier("gatewayExecutor") ExecutorService executor,
                                TimeLimiter gatewayTimeLimiter,
                                Retry gatewayRetry,
                                RateLimiter gatewayRateLimiter) {
        this.chatClient = builder.build();
        this.mapper = mapper;
        this.executor = executor;
        this.timeLimiter = gatewayTimeLimiter;
        this.retry = gatewayRetry;
        this.rateLimiter = gatewayRateLimiter;
        retry.getEventPublisher().onRetry(event -> log.warn("Gateway attempt {} failed, retrying: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    public JsonNode call(GatewayRequest request) {
        GatewayTask task = request.task();
        Prompt prompt = new PromptTemplate(TEMPLATES.get(task)).create(Map.of(
                "text", request.text(),
                "context", request.context().isEmpty() ? "(none)" : String.join("\n", request.context())
        ));
        return retry.executeSupplier(() -> validate(task, parse(task, invoke(task, prompt))));
    }

    private String invoke(GatewayTask task, Prompt prompt) {
        if (!rateLimiter.acquirePermission()) {
            throw new GatewayException(task, "rate limit exceeded", false);
        }
        AtomicReference<Future<String>> submitted = new AtomicReference<>();
        String content;
        try {
            content = timeLimiter.executeFutureSupplier(() -> {
                Future<String> future = executor.submit(() -> chatClient.prompt(prompt).call().content());
                submitted.set(future);
                return future;
            });
        } catch (TimeoutException e) {
            throw new GatewayException(task, "no response within "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + "ms", true, e);
        } catch (InterruptedException e) {
            Future<String> future = submitted.get();
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new GatewayException(task, "interrupted", false, e);
        } catch (Exception e) {
            throw new GatewayException(task, "call failed: " + e, true, e);
        }
        if (content == null || content.isBlank()) {
            throw new GatewayException(task, "empty response", true);
        }
        return content;
    }

    private JsonNode parse(GatewayTask task, String content) {
        String cleaned = content.replace("```json", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new GatewayException(task, "response is not a JSON object", false);
        }
        try {
            return mapper.readTree(cleaned.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new GatewayException(task, "malformed JSON: " + e.getOriginalMessage(), false, e);
        }
    }

    private static JsonNode validate(GatewayTask task, JsonNode node) {
        boolean valid = switch (task) {
            case INTENT -> node.path("intent").isTextual()
                    && (node.path("confidence").isMissingNode() || node.path("confidence").isNumber());
            case SLOT_EXTRACT -> node.path("slots").isObject();
            case EXPLAIN -> node.path("explanations").isObject();
            case CONDITIONS -> node.path("conditions").isArray();
        };
        if (!valid) {
            throw new GatewayException(task, "response does not match the " + task + " schema", false);
        }
        return node;
    }
}
