package org.lime.foodrecommender.conversation;

import java.util.List;

public record MergeReport(List<String> applied, List<String> discarded) {

    public MergeReport {
        applied = List.copyOf(applied);
        discarded = List.copyOf(discarded);
    }
}
