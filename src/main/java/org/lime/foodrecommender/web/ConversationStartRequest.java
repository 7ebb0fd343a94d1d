package org.lime.foodrecommender.web;

public record ConversationStartRequest(String userId) {
}
