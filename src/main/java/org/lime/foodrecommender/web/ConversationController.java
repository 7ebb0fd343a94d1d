package org.lime.foodrecommender.web;

import jakarta.validation.Valid;
import org.lime.foodrecommender.orchestration.Orchestrator;
import org.lime.foodrecommender.orchestration.SearchHistoryEntry;
import org.lime.foodrecommender.orchestration.TurnResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final Orchestrator orchestrator;

    public ConversationController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public TurnResponse start(@RequestBody(required = false) ConversationStartRequest request) {
        String userId = request != null ? request.userId() : null;
        return orchestrator.startConversation(userId);
    }

    @PostMapping("/{sessionId}/messages")
    public TurnResponse reply(@PathVariable String sessionId,
                              @Valid @RequestBody UserMessageRequest request) {
        return orchestrator.handleTurn(sessionId, request.message());
    }

    @GetMapping("/{sessionId}/history")
    public List<SearchHistoryEntry> history(@PathVariable String sessionId) {
        return orchestrator.searchHistory(sessionId);
    }

    @GetMapping("/{sessionId}/history/{index}")
    public SearchHistoryEntry search(@PathVariable String sessionId, @PathVariable int index) {
        return orchestrator.search(sessionId, index);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        orchestrator.endConversation(sessionId);
        return ResponseEntity.noContent().build();
    }
}
