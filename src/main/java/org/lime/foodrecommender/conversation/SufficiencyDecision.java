package org.lime.foodrecommender.conversation;

import java.util.List;

public record SufficiencyDecision(boolean sufficient, String missingRequirement, List<String> missingSlots) {

    public static SufficiencyDecision satisfied() {
        return new SufficiencyDecision(true, null, List.of());
    }

    public static SufficiencyDecision notApplicable() {
        return new SufficiencyDecision(false, null, List.of());
    }

    public static SufficiencyDecision missing(String requirement, List<String> slots) {
        return new SufficiencyDecision(false, requirement, List.copyOf(slots));
    }
}
