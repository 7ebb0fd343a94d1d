package org.lime.foodrecommender.conversation;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public class SessionMemory {

    public static final int DEFAULT_SEARCH_HISTORY_LIMIT = 50;

    private final String id;
    private final String userId;
    private final String personaId;
    private final int historyCycles;
    private final List<Turn> turns = new ArrayList<>();
    private final SlotSet slots = new SlotSet();
    private final Set<String> pendingClarifications = new LinkedHashSet<>();
    private final Deque<RecommendationCycle> recommendationHistory = new ArrayDeque<>();
    private final Deque<SearchRecord> searchHistory = new ArrayDeque<>();
    private final int searchHistoryLimit;
    private int searchSequence;
    private final ConversationMetrics metrics = new ConversationMetrics();

    private volatile Instant lastActivity = Instant.now();

    public SessionMemory(String userId, String personaId, int historyCycles) {
        this(UUID.randomUUID().toString(), userId, personaId, historyCycles);
    }

    public SessionMemory(String id, String userId, String personaId, int historyCycles) {
        this(id, userId, personaId, historyCycles, DEFAULT_SEARCH_HISTORY_LIMIT);
    }

    public SessionMemory(String id, String userId, String personaId, int historyCycles, int searchHistoryLimit) {
        this.id = id;
        this.userId = userId;
        this.personaId = personaId;
        this.historyCycles = Math.max(1, historyCycles);
        this.searchHistoryLimit = Math.max(1, searchHistoryLimit);
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getPersonaId() {
        return personaId;
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public SlotSet getSlots() {
        return slots;
    }

    public Set<String> getPendingClarifications() {
        return Collections.unmodifiableSet(pendingClarifications);
    }

    public ConversationMetrics getMetrics() {
        return metrics;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public void recordTurn(Turn turn) {
        turns.add(turn);
        lastActivity = turn.timestamp();
        if (turn.speaker() == Speaker.USER) {
            metrics.incrementTurn();
        }
    }

    /**
     * The newest {@code window} turns, oldest first.
     */
    public List<Turn> recentTurns(int window) {
        int from = Math.max(0, turns.size() - window);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public void replacePendingClarifications(Collection<String> slotNames) {
        pendingClarifications.clear();
        pendingClarifications.addAll(slotNames);
    }

    public void restore(SlotSet previousSlots, Collection<String> previousPending) {
        slots.replaceWith(previousSlots);
        replacePendingClarifications(previousPending);
    }

    public void recordRecommendation(RecommendationCycle cycle) {
        recommendationHistory.addLast(cycle);
        while (recommendationHistory.size() > historyCycles) {
            recommendationHistory.removeFirst();
        }
    }

    /**
     * Past recommendation cycles, oldest first, bounded by the configured window.
     */
    public List<RecommendationCycle> getRecommendationHistory() {
        return List.copyOf(recommendationHistory);
    }

    public Set<String> recentlyShownCuisines() {
        Set<String> cuisines = new LinkedHashSet<>();
        recommendationHistory.forEach(cycle -> cuisines.addAll(cycle.cuisines()));
        return cuisines;
    }

    public SearchRecord recordSearch(String query,
                                     Map<String, Object> filters,
                                     List<String> conditions,
                                     List<String> itemIds,
                                     boolean degraded,
                                     Instant timestamp) {
        SearchRecord record = new SearchRecord(searchSequence++, query, filters, conditions, itemIds, degraded, timestamp);
        searchHistory.addLast(record);
        while (searchHistory.size() > searchHistoryLimit) {
            searchHistory.removeFirst();
        }
        return record;
    }

    /**
     * Executed searches, oldest first. Sequence numbers keep counting after old entries are dropped.
     */
    public List<SearchRecord> getSearchHistory() {
        return List.copyOf(searchHistory);
    }
}
