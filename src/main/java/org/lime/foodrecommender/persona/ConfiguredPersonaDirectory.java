package org.lime.foodrecommender.persona;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class ConfiguredPersonaDirectory implements PersonaDirectory {

    private final Map<String, String> assignments;
    private final String defaultPersona;

    public ConfiguredPersonaDirectory(FoodRecommenderProperties properties) {
        this.assignments = Map.copyOf(properties.getPersona().getAssignments());
        this.defaultPersona = properties.getPersona().getDefaultPersona();
    }

    @Override
    public String personaFor(String userId) {
        if (userId == null || userId.isBlank()) {
            return defaultPersona;
        }
        String persona = assignments.get(userId);
        if (persona == null) {
            log.debug("No persona assigned to user {}, using {}", userId, defaultPersona);
            return defaultPersona;
        }
        return persona;
    }
}
