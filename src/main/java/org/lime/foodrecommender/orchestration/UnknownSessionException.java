package org.lime.foodrecommender.orchestration;

public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String sessionId) {
        super("Unknown conversation: " + sessionId);
    }
}
