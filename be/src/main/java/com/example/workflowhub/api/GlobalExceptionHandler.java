package com.example.workflowhub.api;

import com.example.workflowhub.sync.ExternalSyncException;
import com.example.workflowhub.validation.ValidationError;
import com.example.workflowhub.validation.WorkflowDefinitionValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Central exception handling for the REST API.
 * <p>
 * Maps exceptions to HTTP status and {@link ErrorResponse} body: unknown entity or workflow → 404,
 * unknown state, definition and bean validation → 400, actor not permitted → 403, sync failure → 502.
 * No stack traces or payload contents in responses.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(EntityNotFoundException ex) {
        log.warn("Entity not found: {}", ex.getEntityId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("EntityNotFound", "Entity not found: " + ex.getEntityId()));
    }

    @ExceptionHandler(UnknownWorkflowException.class)
    public ResponseEntity<ErrorResponse> handleUnknownWorkflow(UnknownWorkflowException ex) {
        log.warn("Unknown workflow: {}", ex.getWorkflowType());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("UnknownWorkflow", ex.getMessage()));
    }

    @ExceptionHandler(UnknownStateException.class)
    public ResponseEntity<ErrorResponse> handleUnknownState(UnknownStateException ex) {
        log.warn("Unknown state {} for workflow {}", ex.getState(), ex.getWorkflowType());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("UnknownState", ex.getMessage()));
    }

    @ExceptionHandler(WorkflowDefinitionValidationException.class)
    public ResponseEntity<ErrorResponse> handleDefinitionValidation(WorkflowDefinitionValidationException ex) {
        log.warn("Workflow definition validation failed: {} errors={}", ex.getMessage(), ex.getErrors() != null ? ex.getErrors().size() : 0);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("InvalidDefinition", ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ValidationError(fe.getField(), fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.toList());
        log.warn("Bean validation failed: {} field errors", errors.size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("ValidationFailed", "Validation failed", errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getClass().getSimpleName());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MalformedRequest", "Request could not be read"));
    }

    @ExceptionHandler(ActorNotPermittedException.class)
    public ResponseEntity<ErrorResponse> handleActorNotPermitted(ActorNotPermittedException ex) {
        log.warn("Actor not permitted: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("ActorNotPermitted", ex.getMessage()));
    }

    @ExceptionHandler(TransitionCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(TransitionCancelledException ex) {
        log.info("Transition cancelled: {}", ex.getEntityId());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("TransitionCancelled", ex.getMessage()));
    }

    @ExceptionHandler(ExternalSyncException.class)
    public ResponseEntity<ErrorResponse> handleSyncFailure(ExternalSyncException ex) {
        log.error("External sync failed: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("SyncFailed", "System of record unavailable"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("InvalidRequest", ex.getMessage() != null ? ex.getMessage() : "Invalid request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        log.debug("Resource not found: {}", ex.getResourcePath());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NotFound", "Not found: " + ex.getResourcePath()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("InternalError", "An internal error occurred"));
    }
}
