package org.lime.foodrecommender.conversation;

import java.util.List;

public record DialogueOutcome(Intent intent,
                              SlotSet slots,
                              boolean sufficient,
                              String missingRequirement,
                              List<String> missingSlots,
                              List<String> discardedSlots) {
}
