package org.lime.foodrecommender.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lime.foodrecommender.orchestration.Orchestrator;
import org.lime.foodrecommender.orchestration.SearchHistoryEntry;
import org.lime.foodrecommender.orchestration.TurnResponse;
import org.lime.foodrecommender.orchestration.TurnResponse.RecommendationItem;
import org.lime.foodrecommender.orchestration.TurnResponse.Status;
import org.lime.foodrecommender.orchestration.UnknownSearchException;
import org.lime.foodrecommender.orchestration.UnknownSessionException;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ConversationControllerTest {

    @Mock
    private Orchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ConversationController(orchestrator))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static TurnResponse.TurnResponseBuilder response(Status status, String message) {
        return TurnResponse.builder()
                .sessionId("s-1")
                .status(status)
                .message(message)
                .missingSlots(List.of())
                .failedShards(Set.of())
                .slots(Map.of())
                .metrics(Map.of());
    }

    @Test
    void startsConversation() throws Exception {
        when(orchestrator.startConversation("demo-budget")).thenReturn(response(Status.GREETING, "Hi!").build());

        mockMvc.perform(post("/api/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"demo-budget\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.status").value("GREETING"));
    }

    @Test
    void relaysRecommendations() throws Exception {
        when(orchestrator.handleTurn("s-1", "spicy veg biryani under 300")).thenReturn(
                response(Status.RECOMMENDED, "Here are my top 1 pick.")
                        .intent("request_recommendation")
                        .item(new RecommendationItem(1, "11", "Kathal Biryani", "Biryani House", 199.0, 4.4, "veg",
                                List.of("hyderabadi"), 0.82, "Picked for the dish you named."))
                        .build());

        mockMvc.perform(post("/api/conversations/s-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"spicy veg biryani under 300\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RECOMMENDED"))
                .andExpect(jsonPath("$.items[0].itemId").value("11"))
                .andExpect(jsonPath("$.items[0].rank").value(1))
                .andExpect(jsonPath("$.items[0].explanation").value("Picked for the dish you named."));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/conversations/s-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void endsConversation() throws Exception {
        mockMvc.perform(delete("/api/conversations/s-1"))
                .andExpect(status().isNoContent());

        verify(orchestrator).endConversation("s-1");
    }

    @Test
    void endingUnknownConversationIsNotFound() throws Exception {
        doThrow(new UnknownSessionException("gone")).when(orchestrator).endConversation(anyString());

        mockMvc.perform(delete("/api/conversations/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("UNKNOWN_SESSION"));
    }

    @Test
    void listsSearchHistory() throws Exception {
        when(orchestrator.searchHistory("s-1")).thenReturn(List.of(new SearchHistoryEntry(
                0, Instant.parse("2026-10-18T12:00:00Z"), "spicy veg biryani",
                Map.of("price", Map.of("max", 300)), List.of("Closer semantic match"), List.of("11", "14"),
                2, false, "Found 2 recommendations for 'spicy veg biryani'")));

        mockMvc.perform(get("/api/conversations/s-1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].index").value(0))
                .andExpect(jsonPath("$[0].query").value("spicy veg biryani"))
                .andExpect(jsonPath("$[0].filters.price.max").value(300))
                .andExpect(jsonPath("$[0].itemIds[1]").value("14"))
                .andExpect(jsonPath("$[0].preview").value("Found 2 recommendations for 'spicy veg biryani'"));
    }

    @Test
    void historyOfUnknownConversationIsNotFound() throws Exception {
        when(orchestrator.searchHistory("gone")).thenThrow(new UnknownSessionException("gone"));

        mockMvc.perform(get("/api/conversations/gone/history"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("UNKNOWN_SESSION"));
    }

    @Test
    void missingSearchIndexIsNotFound() throws Exception {
        when(orchestrator.search("s-1", 7)).thenThrow(new UnknownSearchException("s-1", 7));

        mockMvc.perform(get("/api/conversations/s-1/history/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("UNKNOWN_SEARCH"));
    }
}
