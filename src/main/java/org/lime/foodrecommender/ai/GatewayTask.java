package org.lime.foodrecommender.ai;

public enum GatewayTask {
    INTENT,
    SLOT_EXTRACT,
    EXPLAIN,
    CONDITIONS
}
