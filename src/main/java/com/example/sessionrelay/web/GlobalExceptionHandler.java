package com.example.sessionrelay.web;

import com.example.sessionrelay.exception.GatewayException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "request body is not valid JSON");
    }

    @ExceptionHandler(GatewayException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException e) {
        return error(ErrorStatus.of(e.getKind()), e.getKind().name().toLowerCase(), e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        String message = (e.getReason() != null && !e.getReason().isBlank()) ? e.getReason() : e.getStatus().getReasonPhrase();
        return error(e.getStatus(), e.getStatus().name().toLowerCase(), message);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
