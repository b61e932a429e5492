package com.autoposter.web;

import com.autoposter.service.CycleInProgressException;
import com.autoposter.service.TopicNotFoundException;
import jakarta.validation.ConstraintViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Maps pipeline exceptions onto {@code {code, message}} bodies. Body validation failures
 * additionally carry the first message per rejected field.
 */
@RestControllerAdvice
public class PipelineExceptionHandler {

    @ExceptionHandler(CycleInProgressException.class)
    public ResponseEntity<PipelineErrorResponse> handleCycleInProgress(CycleInProgressException ex) {
        return error(HttpStatus.CONFLICT, "cycle_in_progress", ex.getMessage());
    }

    @ExceptionHandler(TopicNotFoundException.class)
    public ResponseEntity<PipelineErrorResponse> handleTopicNotFound(TopicNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "topic_not_found", ex.getMessage());
    }

    @ExceptionHandler(HistoryClearNotConfirmedException.class)
    public ResponseEntity<PipelineErrorResponse> handleClearNotConfirmed(HistoryClearNotConfirmedException ex) {
        return error(HttpStatus.PRECONDITION_REQUIRED, "confirmation_required", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class})
    public ResponseEntity<PipelineErrorResponse> handleInvalidRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<PipelineErrorResponse> handleInvalidParameters(HandlerMethodValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Request parameters failed validation");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<InvalidBodyResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new TreeMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        String message = fieldErrors.isEmpty()
                ? "Request body is invalid"
                : "Invalid value for " + String.join(", ", fieldErrors.keySet());
        return ResponseEntity.badRequest()
                .body(new InvalidBodyResponse("invalid_request", message, fieldErrors));
    }

    private static ResponseEntity<PipelineErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new PipelineErrorResponse(code, message));
    }

    public record PipelineErrorResponse(
            String code,
            String message
    ) {
    }

    public record InvalidBodyResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
