package org.lime.foodrecommender.conversation;

public enum MergePolicy {
    /** Last write wins. */
    REPLACE,
    /** Set-valued; new values are added to the existing ones. */
    UNION
}
