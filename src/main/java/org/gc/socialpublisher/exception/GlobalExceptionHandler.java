package org.gc.socialpublisher.exception;

import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.dto.StatusResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the engine's exceptions to HTTP statuses with a {@link StatusResponse} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ScheduleValidationException.class)
    public ResponseEntity<StatusResponse> handleValidation(ScheduleValidationException e, WebRequest request) {
        log.warn("Rejected request path={}, message={}", getRequestPath(request), e.getMessage());
        return ResponseEntity.badRequest().body(StatusResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<StatusResponse> handleInvalidBody(MethodArgumentNotValidException e, WebRequest request) {
        return invalidFields(e.getBindingResult().getFieldErrors(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StatusResponse> handleUnreadableBody(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("Unreadable request body path={}", getRequestPath(request));
        return ResponseEntity.badRequest().body(StatusResponse.failure("Malformed JSON body"));
    }

    @ExceptionHandler(EntryNotFoundException.class)
    public ResponseEntity<StatusResponse> handleNotFound(EntryNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(StatusResponse.failure(e.getMessage()));
    }

    @ExceptionHandler({QueueConflictException.class, IllegalPostTransitionException.class})
    public ResponseEntity<StatusResponse> handleConflict(RuntimeException e, WebRequest request) {
        log.warn("Conflict path={}, message={}", getRequestPath(request), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(StatusResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<StatusResponse> handleRateLimit(RateLimitException e, WebRequest request) {
        log.warn("Platform rate limit path={}, message={}", getRequestPath(request), e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tag", "meta_rate_limit");
        if (e.getCode() != null) {
            details.put("code", e.getCode());
        }
        if (e.getRetryAfterSeconds() != null) {
            details.put("retry_after_seconds", e.getRetryAfterSeconds());
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(StatusResponse.failure(e.getMessage(), details));
    }

    @ExceptionHandler(PipelineFailureException.class)
    public ResponseEntity<StatusResponse> handlePipelineFailure(PipelineFailureException e, WebRequest request) {
        log.error("Pipeline failure path={}, message={}", getRequestPath(request), e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tag", e.getTag());
        if (e.getCode() != null) {
            details.put("code", e.getCode());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(StatusResponse.failure(e.getMessage(), details));
    }

    @ExceptionHandler(RemotePlatformException.class)
    public ResponseEntity<StatusResponse> handleRemoteFailure(RemotePlatformException e, WebRequest request) {
        log.error("Platform failure path={}, message={}", getRequestPath(request), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(StatusResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StatusResponse> handleException(Exception e, WebRequest request) {
        log.error("Unexpected error path={}, message={}", getRequestPath(request), e.getMessage(), e);
        return ResponseEntity.internalServerError().body(StatusResponse.failure("Internal error, check the server logs"));
    }

    private ResponseEntity<StatusResponse> invalidFields(List<FieldError> fieldErrors, WebRequest request) {
        String message = fieldErrors.stream()
                .map(FieldError::getDefaultMessage)
                .distinct()
                .collect(Collectors.joining("; "));
        log.warn("Invalid request body path={}, message={}", getRequestPath(request), message);
        return ResponseEntity.badRequest().body(StatusResponse.failure(message.isEmpty() ? "Invalid request" : message));
    }

    private String getRequestPath(WebRequest request) {
        return request == null ? "" : request.getDescription(false).replace("uri=", "");
    }
}
