package com.di.pitnova.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the strategy API.
 *
 * <p>Maps the engine's exception taxonomy onto HTTP statuses:
 * <ul>
 *   <li>{@link InvalidRaceStateException}, validation errors: 400</li>
 *   <li>{@link ModelNotFittedException}: 404, with the missing key</li>
 *   <li>{@link InsufficientDataException}: 422, with found/required sample counts</li>
 *   <li>anything else: 500</li>
 * </ul>
 * Every response carries the {@link ErrorCategory} of the failure.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRaceStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRaceState(InvalidRaceStateException e) {
        return respond("INVALID_RACE_STATE", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ModelNotFittedException.class)
    public ResponseEntity<ErrorResponse> handleModelNotFitted(ModelNotFittedException e) {
        ResponseEntity<ErrorResponse> response = respond("MODEL_NOT_FITTED", e, HttpStatus.NOT_FOUND);
        if (e.getKey() != null && response.getBody() != null) {
            response.getBody().addDetail("trackId", e.getKey().trackId());
            response.getBody().addDetail("compound", e.getKey().compound().name());
        }
        return response;
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException e) {
        ResponseEntity<ErrorResponse> response = respond("INSUFFICIENT_DATA", e, HttpStatus.UNPROCESSABLE_ENTITY);
        if (response.getBody() != null) {
            response.getBody().addDetail("found", e.getFound());
            response.getBody().addDetail("required", e.getRequired());
        }
        return response;
    }

    /**
     * Handles bean-validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleRequestValidation(MethodArgumentNotValidException e) {
        ResponseEntity<ErrorResponse> response = respond("REQUEST_VALIDATION", e, HttpStatus.BAD_REQUEST);
        if (response.getBody() != null) {
            String fields = e.getBindingResult().getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining("; "));
            response.getBody().setMessage(fields);
        }
        return response;
    }

    /**
     * Handles malformed JSON bodies, including unknown compound names.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond("UNREADABLE_BODY", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors (IllegalArgumentException, IllegalStateException).
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("[API] {} [{}]: {}", eventType, category.getName(), e.getMessage(), e);
        } else {
            log.warn("[API] {} [{}]: {}", eventType, category.getName(), e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
