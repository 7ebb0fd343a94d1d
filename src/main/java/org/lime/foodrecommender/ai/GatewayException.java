package org.lime.foodrecommender.ai;

public class GatewayException extends RuntimeException {

    private final GatewayTask task;
    private final boolean retryable;

    public GatewayException(GatewayTask task, String message, boolean retryable) {
        super(message);
        this.task = task;
        this.retryable = retryable;
    }

    public GatewayException(GatewayTask task, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.task = task;
        this.retryable = retryable;
    }

    public GatewayTask getTask() {
        return task;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
