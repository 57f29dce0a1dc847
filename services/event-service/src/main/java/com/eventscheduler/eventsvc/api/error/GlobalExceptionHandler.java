package com.eventscheduler.eventsvc.api.error;

import com.eventscheduler.eventsvc.shared.exception.EventServiceException;
import com.eventscheduler.eventsvc.shared.exception.RateLimitedException;
import com.eventscheduler.eventsvc.shared.exception.ValidationException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.FieldError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * Maps exceptions to RFC 7807 Problem Detail responses. Domain exceptions carry their own code and status;
 * framework exceptions are translated to the same codes so clients see one error shape.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(ex.getErrorCode(), ex.getHttpStatus(),
                "Too many requests. Please try again later.", request)
                .with("retryAfter", ex.getRetryAfterSeconds());

        log.warn("Rate limit exceeded: correlationId={}", problem.correlationId());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problem);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return validationResponse(ex.getErrors(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleBeanValidation(MethodArgumentNotValidException ex,
                                                              HttpServletRequest request) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> FieldError.of(e.getField(), "REQUIRED", e.getDefaultMessage()))
                .toList();
        return validationResponse(errors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return validationResponse(
                List.of(FieldError.of("body", "MALFORMED", "Request body is missing or malformed")), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return validationResponse(
                List.of(FieldError.of(ex.getName(), "INVALID", ex.getName() + " has an invalid value")), request);
    }

    @ExceptionHandler(EventServiceException.class)
    public ResponseEntity<ProblemDetail> handleDomain(EventServiceException ex, HttpServletRequest request) {
        return respond(problem(ex.getErrorCode(), ex.getHttpStatus(), ex.getMessage(), request));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthentication(AuthenticationException ex, HttpServletRequest request) {
        return respond(problem("UNAUTHORIZED", 401, "Authentication is required", request));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return respond(problem("FORBIDDEN", 403, "Access is denied", request));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(problem("NOT_FOUND", 404, "No such resource", request));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                  HttpServletRequest request) {
        return respond(problem("METHOD_NOT_ALLOWED", 405, ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        ProblemDetail problem = problem("INTERNAL_ERROR", 500, "An unexpected error occurred", request);
        log.error("Unexpected error: correlationId={}", problem.correlationId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ResponseEntity<ProblemDetail> validationResponse(List<FieldError> errors, HttpServletRequest request) {
        ProblemDetail problem = problem("VALIDATION_ERROR", 400, "One or more validation errors occurred", request)
                .with("errors", errors);
        log.debug("Validation error: correlationId={}, errors={}", problem.correlationId(), errors);
        return ResponseEntity.badRequest().body(problem);
    }

    private ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        log.debug("Handled exception: type={}, correlationId={}", problem.errorCode(), problem.correlationId());
        return ResponseEntity.status(problem.status()).body(problem);
    }

    private ProblemDetail problem(String errorCode, int status, String detail, HttpServletRequest request) {
        return ProblemDetail.forCode(errorCode, status, detail, request.getRequestURI(),
                securityUtils.getCurrentCorrelationId());
    }
}
