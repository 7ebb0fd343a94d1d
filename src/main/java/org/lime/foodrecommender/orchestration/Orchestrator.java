package org.lime.foodrecommender.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.DialogueManager;
import org.lime.foodrecommender.conversation.DialogueOutcome;
import org.lime.foodrecommender.conversation.QuestionGenerationService;
import org.lime.foodrecommender.conversation.SearchRecord;
import org.lime.foodrecommender.conversation.SessionMemory;
import org.lime.foodrecommender.conversation.SlotSet;
import org.lime.foodrecommender.conversation.Turn;
import org.lime.foodrecommender.menu.CatalogService;
import org.lime.foodrecommender.persona.PersonaDirectory;
import org.lime.foodrecommender.rerank.RankedResult;
import org.lime.foodrecommender.rerank.RankingCondition;
import org.lime.foodrecommender.rerank.RerankOutcome;
import org.lime.foodrecommender.rerank.RerankingEngine;
import org.lime.foodrecommender.rerank.ScoredCandidate;
import org.lime.foodrecommender.retrieval.CandidateItem;
import org.lime.foodrecommender.retrieval.FilterConstraint;
import org.lime.foodrecommender.retrieval.Query;
import org.lime.foodrecommender.retrieval.QueryEnhancer;
import org.lime.foodrecommender.retrieval.RetrievalResult;
import org.lime.foodrecommender.retrieval.ShardRetrievalCoordinator;
import org.lime.foodrecommender.retrieval.TotalRetrievalFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.lime.foodrecommender.orchestration.TurnResponse.*;

/**
 * Per-turn driver. Turns of one session are serialized on that session's memory.
 */
@Slf4j
@Service
public class Orchestrator {

    private final SessionRegistry registry;
    private final DialogueManager dialogueManager;
    private final QueryEnhancer queryEnhancer;
    private final ShardRetrievalCoordinator retrievalCoordinator;
    private final RerankingEngine rerankingEngine;
    private final QuestionGenerationService questions;
    private final CatalogService catalogService;
    private final PersonaDirectory personaDirectory;
    private final FoodRecommenderProperties properties;

    public Orchestrator(SessionRegistry registry,
                        DialogueManager dialogueManager,
                        QueryEnhancer queryEnhancer,
                        ShardRetrievalCoordinator retrievalCoordinator,
                        RerankingEngine rerankingEngine,
                        QuestionGenerationService questions,
                        CatalogService catalogService,
                        PersonaDirectory personaDirectory,
                        FoodRecommenderProperties properties) {
        this.registry = registry;
        this.dialogueManager = dialogueManager;
        this.queryEnhancer = queryEnhancer;
        this.retrievalCoordinator = retrievalCoordinator;
        this.rerankingEngine = rerankingEngine;
        this.questions = questions;
        this.catalogService = catalogService;
        this.personaDirectory = personaDirectory;
        this.properties = properties;
    }

    public TurnResponse startConversation(String userId) {
        SessionMemory memory = registry.register(newMemory(UUID.randomUUID().toString(), userId));
        String greeting = questions.greeting();
        synchronized (memory) {
            memory.recordTurn(Turn.system(greeting));
        }
        log.info("Started conversation {} (persona {})", memory.getId(), memory.getPersonaId());
        return base(memory, Status.GREETING, null, greeting).build();
    }

    public TurnResponse handleTurn(String sessionId, String rawText) {
        SessionMemory memory = registry.getOrCreate(sessionId, id -> newMemory(id, null));
        synchronized (memory) {
            SlotSet slotsBefore = memory.getSlots().copy();
            Set<String> pendingBefore = new LinkedHashSet<>(memory.getPendingClarifications());

            DialogueOutcome outcome = dialogueManager.processTurn(rawText, memory);
            TurnResponse response = switch (outcome.intent()) {
                case GREETING -> base(memory, Status.GREETING, outcome, questions.greeting()).build();
                case GOODBYE -> {
                    registry.evict(memory.getId());
                    yield base(memory, Status.ENDED, outcome, questions.farewell()).build();
                }
                case UNKNOWN -> base(memory, Status.UNCLEAR, outcome, questions.unclear()).build();
                default -> outcome.sufficient()
                        ? recommend(memory, outcome, slotsBefore, pendingBefore)
                        : base(memory, Status.COLLECTING, outcome,
                        questions.followUp(outcome.missingRequirement(), memory.getSlots()))
                        .missingSlots(outcome.missingSlots())
                        .build();
            };
            memory.recordTurn(Turn.system(response.message()));
            return response;
        }
    }

    public List<SearchHistoryEntry> searchHistory(String sessionId) {
        SessionMemory memory = registry.find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
        List<SearchRecord> records;
        synchronized (memory) {
            records = memory.getSearchHistory();
        }
        return records.stream().map(SearchHistoryEntry::from).toList();
    }

    public SearchHistoryEntry search(String sessionId, int index) {
        return searchHistory(sessionId).stream()
                .filter(entry -> entry.index() == index)
                .findFirst()
                .orElseThrow(() -> new UnknownSearchException(sessionId, index));
    }

    public void endConversation(String sessionId) {
        if (!registry.evict(sessionId)) {
            throw new UnknownSessionException(sessionId);
        }
        log.info("Ended conversation {}", sessionId);
    }

    private TurnResponse recommend(SessionMemory memory,
                                   DialogueOutcome outcome,
                                   SlotSet slotsBefore,
                                   Set<String> pendingBefore) {
        Query query = queryEnhancer.buildQuery(memory.getSlots());
        RetrievalResult retrieval;
        try {
            retrieval = retrievalCoordinator.retrieve(
                    query,
                    shardIds(),
                    properties.getRetrieval().getTopNPerShard(),
                    properties.getRetrieval().getCandidateCap());
        } catch (TotalRetrievalFailureException e) {
            log.warn("Session {}: {}, asking user to retry", memory.getId(), e.getMessage());
            memory.restore(slotsBefore, pendingBefore);
            memory.getMetrics().retryResponse();
            return base(memory, Status.RETRY, outcome, questions.retry())
                    .degraded(true)
                    .failedShards(e.getFailedShards())
                    .build();
        }

        RerankOutcome ranked = rerankingEngine.rerank(retrieval.candidates(), memory, memory.getPersonaId());
        memory.getMetrics().recommendationCycle(retrieval.degraded());
        memory.recordSearch(
                query.semanticText(),
                describe(query.filters()),
                ranked.conditions().stream().map(RankingCondition::description).toList(),
                ranked.results().stream().map(RankedResult::itemId).toList(),
                retrieval.degraded(),
                Instant.now());
        if (ranked.results().isEmpty()) {
            return base(memory, Status.NO_MATCH, outcome, questions.noMatch(memory.getSlots()))
                    .degraded(retrieval.degraded())
                    .failedShards(retrieval.failedShards())
                    .build();
        }

        Map<String, CandidateItem> byId = ranked.selected().stream()
                .map(ScoredCandidate::item)
                .collect(Collectors.toMap(CandidateItem::itemId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        List<RecommendationItem> items = new ArrayList<>(ranked.results().size());
        for (RankedResult result : ranked.results()) {
            items.add(toItem(result, byId.get(result.itemId())));
        }
        return base(memory, Status.RECOMMENDED, outcome,
                questions.recommendationHeadline(memory.getSlots(), items.size()))
                .items(items)
                .conditions(ranked.conditions().stream().map(Orchestrator::summarize).toList())
                .degraded(retrieval.degraded())
                .failedShards(retrieval.failedShards())
                .build();
    }

    private List<Integer> shardIds() {
        List<Integer> configured = properties.getRetrieval().getShards();
        return configured == null || configured.isEmpty() ? catalogService.shardIds() : configured;
    }

    private SessionMemory newMemory(String sessionId, String userId) {
        return new SessionMemory(
                sessionId,
                userId,
                personaDirectory.personaFor(userId),
                properties.getRerank().getHistoryCycles(),
                properties.getSession().getSearchHistoryLimit());
    }

    private static Map<String, Object> describe(Map<String, FilterConstraint> filters) {
        Map<String, Object> described = new LinkedHashMap<>();
        filters.forEach((attribute, constraint) -> {
            switch (constraint.kind()) {
                case EQUALS -> described.put(attribute, constraint.value());
                case IN -> described.put(attribute, List.copyOf(constraint.values()));
                case RANGE -> {
                    Map<String, Object> range = new LinkedHashMap<>();
                    if (constraint.min() != null) {
                        range.put("min", constraint.min());
                    }
                    if (constraint.max() != null) {
                        range.put("max", constraint.max());
                    }
                    described.put(attribute, range);
                }
            }
        });
        return described;
    }

    private RecommendationItem toItem(RankedResult result, CandidateItem candidate) {
        Map<String, Object> metadata = catalogService.metadataFor(result.itemId())
                .orElse(candidate == null ? Map.of() : candidate.metadata());
        Object cuisines = metadata.get("cuisines");
        return new RecommendationItem(
                result.rank(),
                result.itemId(),
                (String) metadata.get("name"),
                (String) metadata.get("restaurant"),
                metadata.get("price") instanceof Number n ? n.doubleValue() : null,
                metadata.get("rating") instanceof Number n ? n.doubleValue() : null,
                (String) metadata.get("dietary"),
                cuisines instanceof List<?> list ? list.stream().map(String::valueOf).toList() : List.of(),
                result.finalScore(),
                result.explanation());
    }

    private static ConditionSummary summarize(RankingCondition condition) {
        return new ConditionSummary(condition.name(), condition.weight(), condition.description());
    }

    private static TurnResponse.TurnResponseBuilder base(SessionMemory memory,
                                                         Status status,
                                                         DialogueOutcome outcome,
                                                         String message) {
        return TurnResponse.builder()
                .sessionId(memory.getId())
                .status(status)
                .intent(outcome == null ? null : outcome.intent().getWireName())
                .message(message)
                .missingSlots(List.of())
                .failedShards(Set.of())
                .slots(new LinkedHashMap<>(memory.getSlots().asMap()))
                .metrics(memory.getMetrics().snapshot());
    }
}
