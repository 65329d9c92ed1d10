package com.skillbench.dispatch.api;

import com.skillbench.core.persistence.StoreException;
import com.skillbench.core.state.EvaluationStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps state errors to HTTP statuses with a {@code {code, error}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EvaluationStateException.class)
    public ResponseEntity<Map<String, String>> handleState(EvaluationStateException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case ALREADY_RUNNING, NOT_RUNNING, NOT_PAUSED -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_PARAMS -> HttpStatus.BAD_REQUEST;
        };
        log.debug("Request rejected [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(body(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, String>> handleStore(StoreException ex) {
        log.error("Store failure while serving request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("STORE_ERROR", ex.getMessage()));
    }

    private static Map<String, String> body(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("error", message == null ? code : message);
        return body;
    }
}
