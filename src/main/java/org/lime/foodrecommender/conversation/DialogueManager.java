package org.lime.foodrecommender.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.ai.FallbackClassifier;
import org.lime.foodrecommender.ai.GatewayException;
import org.lime.foodrecommender.ai.GatewayRequest;
import org.lime.foodrecommender.ai.GatewayTask;
import org.lime.foodrecommender.ai.LanguageModelGateway;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one raw user message into an intent, merged slots and a sufficiency decision.
 * It is the only component that mutates a {@link SessionMemory}'s slots during a turn.
 */
@Slf4j
@Service
public class DialogueManager {

    private static final TypeReference<Map<String, Object>> SLOT_MAP = new TypeReference<>() {
    };

    private final LanguageModelGateway gateway;
    private final FallbackClassifier fallback;
    private final SlotSchema schema;
    private final SufficiencyPolicy sufficiencyPolicy;
    private final ObjectMapper mapper;
    private final int historyWindow;
    private final double minConfidence;

    public DialogueManager(LanguageModelGateway gateway,
                           FallbackClassifier fallback,
                           SlotSchema schema,
                           SufficiencyPolicy sufficiencyPolicy,
                           ObjectMapper mapper,
                           FoodRecommenderProperties properties) {
        this.gateway = gateway;
        this.fallback = fallback;
        this.schema = schema;
        this.sufficiencyPolicy = sufficiencyPolicy;
        this.mapper = mapper;
        this.historyWindow = properties.getDialogue().getHistoryWindow();
        this.minConfidence = properties.getDialogue().getMinIntentConfidence();
    }

    public DialogueOutcome processTurn(String rawText, SessionMemory memory) {
        String text = rawText == null ? "" : rawText.trim();
        List<String> context = memory.recentTurns(historyWindow).stream()
                .map(Turn::asContextLine)
                .toList();
        boolean clarificationPending = !memory.getPendingClarifications().isEmpty();

        Intent intent = classify(text, context, clarificationPending, memory);
        memory.recordTurn(Turn.user(text, intent));

        List<String> discarded = List.of();
        if (intent.isSlotBearing()) {
            discarded = extractAndMerge(text, memory);
        }

        SufficiencyDecision decision = sufficiencyPolicy.evaluate(intent, memory.getSlots());
        if (intent.isSlotBearing()) {
            memory.replacePendingClarifications(decision.missingSlots());
        }
        return new DialogueOutcome(
                intent,
                memory.getSlots().copy(),
                decision.sufficient(),
                decision.missingRequirement(),
                decision.missingSlots(),
                discarded
        );
    }

    private Intent classify(String text, List<String> context, boolean clarificationPending, SessionMemory memory) {
        if (text.isEmpty()) {
            return Intent.UNKNOWN;
        }
        try {
            JsonNode payload = gateway.call(new GatewayRequest(GatewayTask.INTENT, text, context));
            String label = payload.path("intent").asText();
            double confidence = payload.path("confidence").asDouble(1.0);
            Optional<Intent> parsed = Intent.fromWire(label);
            if (parsed.isPresent() && confidence >= minConfidence) {
                return parsed.get();
            }
            log.info("Model intent '{}' (confidence {}) rejected, using rules", label, confidence);
        } catch (GatewayException e) {
            log.warn("Intent classification unavailable: {}", e.getMessage());
        }
        memory.getMetrics().fallbackClassification();
        return fallback.classify(text, clarificationPending);
    }

    private List<String> extractAndMerge(String text, SessionMemory memory) {
        Map<String, Object> raw;
        boolean newQuery = false;
        try {
            List<String> known = new ArrayList<>();
            memory.getSlots().asMap().forEach((slot, value) -> known.add(slot + ": " + value));
            JsonNode payload = gateway.call(new GatewayRequest(GatewayTask.SLOT_EXTRACT, text, known));
            raw = new LinkedHashMap<>(mapper.convertValue(payload.get("slots"), SLOT_MAP));
            newQuery = payload.path("new_query").asBoolean(false);
            fallback.extractSlots(text).forEach(raw::putIfAbsent);
        } catch (GatewayException | IllegalArgumentException e) {
            log.warn("Slot extraction unavailable, using patterns: {}", e.getMessage());
            memory.getMetrics().fallbackExtraction();
            raw = fallback.extractSlots(text);
        }
        if (newQuery) {
            log.debug("New query in session {}, clearing slots", memory.getId());
            memory.getSlots().clear();
        }
        MergeReport report = schema.mergeInto(memory.getSlots(), raw);
        memory.getMetrics().discardedSlotValues(report.discarded().size());
        return report.discarded();
    }
}
