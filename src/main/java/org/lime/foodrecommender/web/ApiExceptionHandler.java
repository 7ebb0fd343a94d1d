package org.lime.foodrecommender.web;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.orchestration.UnknownSearchException;
import org.lime.foodrecommender.orchestration.UnknownSessionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "org.lime.foodrecommender.web")
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownSessionException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownSession(UnknownSessionException e) {
        log.warn("Conversation lookup failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage(), "UNKNOWN_SESSION"));
    }

    @ExceptionHandler(UnknownSearchException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownSearch(UnknownSearchException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage(), "UNKNOWN_SEARCH"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("invalid request");
        return ResponseEntity.badRequest().body(error(detail, "INVALID_REQUEST"));
    }

    private static Map<String, Object> error(String message, String type) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        errorResponse.put("type", type);
        errorResponse.put("timestamp", LocalDateTime.now());
        return errorResponse;
    }
}
