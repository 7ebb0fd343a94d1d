package org.lime.foodrecommender.rerank;

public record RankedResult(String itemId, double finalScore, String explanation, int rank) {
}
