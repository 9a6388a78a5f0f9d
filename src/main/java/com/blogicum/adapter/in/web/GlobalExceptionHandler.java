package com.blogicum.adapter.in.web;

import com.blogicum.adapter.in.web.BlogResponses.ErrorResponse;
import com.blogicum.domain.error.BlogError;
import com.blogicum.infrastructure.context.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for request binding problems and unexpected errors.
 * Expected business logic errors are handled via Result types in controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final BlogResponses responses;

    public GlobalExceptionHandler(BlogResponses responses) {
        this.responses = responses;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(
            MethodArgumentNotValidException ex, HandlerMethod handler, HttpServletRequest request) {
        if (anonymousOnLoginRequired(handler)) {
            return responses.error(BlogError.AuthenticationRequired.INSTANCE, request);
        }
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", message, RequestContext.getRequestId()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadableBody(
            HttpMessageNotReadableException ex, HandlerMethod handler, HttpServletRequest request) {
        if (anonymousOnLoginRequired(handler)) {
            return responses.error(BlogError.AuthenticationRequired.INSTANCE, request);
        }
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read", RequestContext.getRequestId()));
    }

    /**
     * Identifiers in the path are UUIDs; anything else cannot name an existing resource.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.debug("Unparsable path parameter {}: {}", ex.getName(), ex.getValue());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("NOT_FOUND", "No resource with " + ex.getName() + "=" + ex.getValue(),
                RequestContext.getRequestId()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("NOT_FOUND", "No resource at " + ex.getResourcePath(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
            .body(new ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage(), RequestContext.getRequestId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", RequestContext.getRequestId()));
    }

    /**
     * Login comes before body binding: an anonymous write is sent to the login page
     * whatever it carries.
     */
    private static boolean anonymousOnLoginRequired(HandlerMethod handler) {
        return handler != null
            && handler.hasMethodAnnotation(LoginRequired.class)
            && RequestContext.getActor().user().isEmpty();
    }
}
