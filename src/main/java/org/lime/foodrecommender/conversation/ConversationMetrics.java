package org.lime.foodrecommender.conversation;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class ConversationMetrics {

    private int turnCount;
    private int fallbackClassifications;
    private int fallbackExtractions;
    private int discardedSlotValues;
    private int recommendationCycles;
    private int degradedRetrievals;
    private int retryResponses;
    private final Instant createdAt = Instant.now();

    public void incrementTurn() {
        turnCount++;
    }

    public void fallbackClassification() {
        fallbackClassifications++;
    }

    public void fallbackExtraction() {
        fallbackExtractions++;
    }

    public void discardedSlotValues(int count) {
        discardedSlotValues += count;
    }

    public void recommendationCycle(boolean degraded) {
        recommendationCycles++;
        if (degraded) {
            degradedRetrievals++;
        }
    }

    public void retryResponse() {
        retryResponses++;
    }

    public int getTurnCount() {
        return turnCount;
    }

    public int getFallbackClassifications() {
        return fallbackClassifications;
    }

    public int getDiscardedSlotValues() {
        return discardedSlotValues;
    }

    public int getRetryResponses() {
        return retryResponses;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("turnCount", turnCount);
        payload.put("fallbackClassifications", fallbackClassifications);
        payload.put("fallbackExtractions", fallbackExtractions);
        payload.put("discardedSlotValues", discardedSlotValues);
        payload.put("recommendationCycles", recommendationCycles);
        payload.put("degradedRetrievalRate", recommendationCycles == 0 ? 0d : degradedRetrievals * 1.0 / recommendationCycles);
        payload.put("retryResponses", retryResponses);
        payload.put("conversationAgeSeconds", Math.max(0, Instant.now().getEpochSecond() - createdAt.getEpochSecond()));
        return payload;
    }
}
