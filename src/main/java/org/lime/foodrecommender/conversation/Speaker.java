package org.lime.foodrecommender.conversation;

public enum Speaker {
    USER,
    SYSTEM
}
