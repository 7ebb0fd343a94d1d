package org.lime.foodrecommender.conversation;

import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SufficiencyPolicy {

    private final List<FoodRecommenderProperties.Requirement> requirements;

    public SufficiencyPolicy(FoodRecommenderProperties properties) {
        this.requirements = List.copyOf(properties.getSufficiency().getRequirements());
    }

    public SufficiencyDecision evaluate(Intent intent, SlotSet slots) {
        if (!intent.isSlotBearing()) {
            return SufficiencyDecision.notApplicable();
        }
        for (FoodRecommenderProperties.Requirement requirement : requirements) {
            boolean met = requirement.getAnyOf().stream().anyMatch(slots::has);
            if (!met) {
                return SufficiencyDecision.missing(requirement.getName(), requirement.getAnyOf());
            }
        }
        return SufficiencyDecision.satisfied();
    }
}
