package org.lime.foodrecommender.orchestration;

public class UnknownSearchException extends RuntimeException {

    public UnknownSearchException(String sessionId, int index) {
        super("No search " + index + " in conversation " + sessionId);
    }
}
