package org.lime.foodrecommender.ai;

import java.util.List;

public record GatewayRequest(GatewayTask task, String text, List<String> context) {

    public GatewayRequest {
        context = context == null ? List.of() : List.copyOf(context);
        text = text == null ? "" : text;
    }

    public static GatewayRequest of(GatewayTask task, String text) {
        return new GatewayRequest(task, text, List.of());
    }
}
