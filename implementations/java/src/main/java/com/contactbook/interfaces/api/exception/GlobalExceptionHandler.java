package com.contactbook.interfaces.api.exception;

import com.contactbook.application.exceptions.ConflictException;
import com.contactbook.application.exceptions.ExternalServiceException;
import com.contactbook.application.exceptions.ForbiddenException;
import com.contactbook.application.exceptions.InvalidTokenException;
import com.contactbook.application.exceptions.NotFoundException;
import com.contactbook.application.exceptions.UnauthenticatedException;
import com.contactbook.application.exceptions.VerificationException;
import com.contactbook.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Business-rule failures (conflict, not found, unauthenticated, forbidden, invalid
 * token) keep their message. Everything else is logged with its stack trace and
 * answered with a generic 500 that reveals nothing about the cause.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError && !isSecret(fieldName)
                    ? ((FieldError) error).getRejectedValue()
                    : null;

                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .rejectedValue(rejectedValue)
                    .build();
            })
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters",
            request, validationErrors);
    }

    /**
     * Constraint annotations on request parameters, e.g. {@code days >= 1}.
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(
            HandlerMethodValidationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getAllValidationResults()
            .stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(error -> ErrorResponse.ValidationError.builder()
                    .field(result.getMethodParameter().getParameterName())
                    .message(error.getDefaultMessage())
                    .rejectedValue(result.getArgument())
                    .build()))
            .collect(Collectors.toList());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters",
            request, validationErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations()
            .stream()
            .map(violation -> ErrorResponse.ValidationError.builder()
                .field(violation.getPropertyPath().toString())
                .message(violation.getMessage())
                .rejectedValue(violation.getInvalidValue())
                .build())
            .collect(Collectors.toList());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters",
            request, validationErrors);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        MultipartException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request, null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, null);
    }

    /**
     * Covers {@link com.contactbook.application.exceptions.EmailNotConfirmedException} too.
     */
    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(
            UnauthenticatedException ex,
            HttpServletRequest request) {

        ErrorResponse body = errorBody(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request, null);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
            .body(body);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex, HttpServletRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return respond(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request, null);
    }

    /**
     * Status depends on what the token was presented for.
     */
    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidToken(InvalidTokenException ex, HttpServletRequest request) {
        HttpStatus status;
        switch (ex.getPurpose()) {
            case SESSION:
                ErrorResponse body = errorBody(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request, null);
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                    .body(body);
            case EMAIL_CONFIRMATION:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                break;
            default:
                status = HttpStatus.BAD_REQUEST;
        }
        return respond(status, status.getReasonPhrase(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(VerificationException.class)
    public ResponseEntity<ErrorResponse> handleVerification(VerificationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, null);
    }

    /**
     * Handle illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request, null);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternalService(
            ExternalServiceException ex,
            HttpServletRequest request) {

        log.error("External service failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "Bad Gateway", ex.getMessage(), request, null);
    }

    @ExceptionHandler(DatabaseUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseUnavailable(
            DatabaseUnavailableException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), request, null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request, null);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", ex.getMessage(), request, null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", "Resource not found", request, null);
    }

    /**
     * Handle all other exceptions, including corrupt stored credentials and storage
     * failures.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please contact support.", request, null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request,
                                                         List<ErrorResponse.ValidationError> validationErrors) {
        return ResponseEntity.status(status).body(errorBody(status, error, message, request, validationErrors));
    }

    private static ErrorResponse errorBody(HttpStatus status, String error, String message,
                                           HttpServletRequest request,
                                           List<ErrorResponse.ValidationError> validationErrors) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .validationErrors(validationErrors)
            .build();
    }

    private static boolean isSecret(String fieldName) {
        return fieldName != null && fieldName.toLowerCase().contains("password");
    }
}
