package org.lime.foodrecommender.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.SessionMemory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, SessionMemory> sessions = new ConcurrentHashMap<>();
    private final Duration idleTimeout;

    public SessionRegistry(FoodRecommenderProperties properties) {
        this.idleTimeout = properties.getSession().getIdleTimeout();
    }

    public SessionMemory register(SessionMemory memory) {
        sessions.put(memory.getId(), memory);
        return memory;
    }

    public SessionMemory getOrCreate(String sessionId, Function<String, SessionMemory> factory) {
        return sessions.computeIfAbsent(sessionId, factory);
    }

    public Optional<SessionMemory> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean evict(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${foodrec.session.eviction-interval:PT1M}")
    public void evictIdle() {
        evictIdle(Instant.now());
    }

    public int evictIdle(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().getLastActivity().isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle conversation(s)", evicted);
        }
        return evicted;
    }
}
