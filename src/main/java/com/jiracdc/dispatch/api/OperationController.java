package com.jiracdc.dispatch.api;

import com.jiracdc.core.engine.OperationDefaults;
import com.jiracdc.core.engine.OperationNotFoundException;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * REST controller for the operation lifecycle. Errors are rendered by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/operations")
public class OperationController {

    private static final Logger log = LoggerFactory.getLogger(OperationController.class);

    private final OperationProcessor processor;
    private final OperationDefaults defaults;

    public OperationController(OperationProcessor processor, OperationDefaults defaults) {
        this.processor = processor;
        this.defaults = defaults;
    }

    /**
     * POST /api/v1/operations: Start an operation. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<OperationResponse> startOperation(@RequestBody OperationRequest request) {
        OperationKind kind = parseEnum(OperationKind.class, request.kind(), "kind");
        OperationConfig config = defaults.resolve(request.projectKey(), request.activeIssuesOnly(),
                request.issueFilter(), request.pageSize(), request.branch());

        Operation operation = processor.startOperation(kind, config);
        log.info("Accepted {} operation {} for {}", kind, operation.id(), config.projectKey());
        return ResponseEntity.accepted().body(OperationResponse.from(operation));
    }

    /**
     * GET /api/v1/operations: List operations, newest first, optionally filtered by status.
     */
    @GetMapping
    public ResponseEntity<List<OperationResponse>> listOperations(
            @RequestParam(name = "status", required = false) String status) {
        OperationStatus filter = status == null || status.isBlank()
                ? null
                : parseEnum(OperationStatus.class, status, "status");
        return ResponseEntity.ok(processor.listOperations(filter).stream()
                .map(OperationResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResponse> getOperation(@PathVariable String id) {
        return processor.getOperation(id)
                .map(OperationResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new OperationNotFoundException("Operation not found: " + id));
    }

    /**
     * POST /api/v1/operations/{id}/cancel: Cancel a running operation. 409 unless it is RUNNING.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<OperationResponse> cancelOperation(@PathVariable String id) {
        log.info("Cancelling operation {}", id);
        return ResponseEntity.ok(OperationResponse.from(processor.cancelOperation(id)));
    }

    /**
     * POST /api/v1/operations/{id}/retry: Start a new operation with the kind and config of a
     * FAILED or CANCELLED one. 409 for any other status.
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<OperationResponse> retryOperation(@PathVariable String id) {
        Operation retry = processor.retryOperation(id);
        log.info("Accepted retry of operation {} as {}", id, retry.id());
        return ResponseEntity.accepted().body(OperationResponse.from(retry));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid %s: %s. Valid values: %s"
                    .formatted(field, value, Arrays.toString(type.getEnumConstants())));
        }
    }
}
