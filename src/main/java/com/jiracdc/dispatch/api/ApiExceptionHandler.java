package com.jiracdc.dispatch.api;

import com.jiracdc.core.engine.OperationConflictException;
import com.jiracdc.core.engine.OperationNotFoundException;
import com.jiracdc.core.engine.OperationStateException;
import com.jiracdc.core.graph.TaskGraphValidationException;
import com.jiracdc.git.GitWriteException;
import com.jiracdc.source.AuthenticationException;
import com.jiracdc.source.NotFoundException;
import com.jiracdc.source.SourceApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions to HTTP status codes with an {@code {"error": message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, TaskGraphValidationException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({OperationNotFoundException.class, NotFoundException.class, IssueNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({OperationConflictException.class, OperationStateException.class})
    public ResponseEntity<Map<String, String>> conflict(RuntimeException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Map<String, String>> sourceAuth(AuthenticationException e) {
        log.warn("Jira rejected credentials: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({SourceApiException.class, GitWriteException.class})
    public ResponseEntity<Map<String, String>> upstream(RuntimeException e) {
        log.error("Upstream failure: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
