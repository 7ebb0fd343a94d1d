package org.lime.foodrecommender.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserMessageRequest(@NotBlank @Size(max = 1000) String message) {
}
