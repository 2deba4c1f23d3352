package com.example.creatorclaims.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders every error leaving a controller as an RFC 7807 {@link ProblemDetail}.
 * Verification mismatches and disqualifications are business outcomes and never reach this class.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";

    // --- Ownership / verification failures ---

    @ExceptionHandler(UploadException.class)
    public ProblemDetail handleUploadException(UploadException ex, WebRequest request) {
        log.error("Raw video upload to storage failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "The video could not be stored. Please try the upload again.", request);
    }

    @ExceptionHandler(AssetPersistenceException.class)
    public ProblemDetail handleAssetPersistenceException(AssetPersistenceException ex, WebRequest request) {
        if (ex.isObjectOrphaned()) {
            log.error("Asset metadata insert failed AND the stored object could not be removed: {}", ex.getMessage(), ex);
        } else {
            log.error("Asset metadata insert failed, stored object was removed: {}", ex.getMessage(), ex);
        }
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "The video could not be saved. Nothing was kept, please try the upload again.", request);
    }

    @ExceptionHandler(ExternalProviderException.class)
    public ProblemDetail handleExternalProviderException(ExternalProviderException ex, WebRequest request) {
        if (ex.isMisconfigured()) {
            log.error("Scraping provider is not configured: {}", ex.getMessage());
            return problem(HttpStatus.SERVICE_UNAVAILABLE,
                    "Profile verification is not available right now.", request);
        }
        log.error("Scraping provider call failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.BAD_GATEWAY,
                "The profile verification provider could not be reached. Please try again later.", request);
    }

    // --- Spring Security Exceptions ---

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        log.warn("Access Denied for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.FORBIDDEN,
                "Access Denied. You do not have sufficient permissions to access this resource.", request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthenticationException(AuthenticationException ex, WebRequest request) {
        log.warn("Authentication failure for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Authentication failed. Please log in again.", request);
    }

    // --- Bean Validation Exceptions ---

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        log.warn("Constraint violation for request {}: {}", request.getDescription(false), ex.getMessage());

        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> getPropertyName(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first
                ));

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST,
                "Input validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return problemDetail;
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Method argument validation failed for request {}: {}", request.getDescription(false), ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ProblemDetail problemDetail = problem(status,
                "Request body validation failed. Check the 'errors' field for details.", request);
        problemDetail.setTitle(getReasonPhrase(status, "Validation Failed"));
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    // --- General Spring Web Exceptions ---

    @Override
    protected ResponseEntity<Object> handleHttpRequestMethodNotSupported(
            @NonNull HttpRequestMethodNotSupportedException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("HTTP method not supported for {}: {}", request.getDescription(false), ex.getMessage());
        ProblemDetail problemDetail = problem(status, ex.getMessage(), request);

        String[] supportedMethodsArray = ex.getSupportedMethods();
        if (supportedMethodsArray != null && supportedMethodsArray.length > 0) {
            Set<HttpMethod> allowedMethods = Arrays.stream(supportedMethodsArray)
                    .map(HttpMethod::valueOf)
                    .collect(Collectors.toSet());
            headers.setAllow(allowedMethods);
        }
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestParameter(
            @NonNull MissingServletRequestParameterException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Missing request parameter for {}: {}", request.getDescription(false), ex.getMessage());
        return new ResponseEntity<>(problem(status, ex.getMessage(), request), headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestPart(
            @NonNull MissingServletRequestPartException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Missing multipart part for {}: {}", request.getDescription(false), ex.getMessage());
        return new ResponseEntity<>(problem(status, ex.getMessage(), request), headers, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                request.getDescription(false), ex.getStatusCode(), ex.getReason());
        return problem(ex.getStatusCode(), ex.getReason(), request);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                request.getDescription(false), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support.", request);
    }

    /**
     * Catches the exceptions the base class handles itself, so upload-size and unreadable-body
     * failures come back in the same shape as everything else.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        if (ex instanceof MaxUploadSizeExceededException maxEx) {
            log.warn("Max upload size exceeded: {}", maxEx.getMessage());
            ProblemDetail problemDetail = problem(HttpStatus.PAYLOAD_TOO_LARGE,
                    "Maximum upload size exceeded. " + maxEx.getLocalizedMessage(), request);
            return new ResponseEntity<>(problemDetail, headers, HttpStatus.PAYLOAD_TOO_LARGE);
        }

        ProblemDetail problemDetailToReturn;
        if (body instanceof ProblemDetail pdBody) {
            problemDetailToReturn = pdBody;
            Map<String, Object> properties = problemDetailToReturn.getProperties();
            if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
                problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
            if (problemDetailToReturn.getInstance() == null) {
                problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            }
            if (problemDetailToReturn.getTitle() == null) {
                problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            String detail = (ex.getCause() != null) ? ex.getCause().getMessage() : ex.getMessage();
            problemDetailToReturn = problem(statusCode, detail, request);
        }

        return new ResponseEntity<>(problemDetailToReturn, headers, statusCode);
    }

    // --- Helper Methods ---

    private ProblemDetail problem(HttpStatusCode status, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(getReasonPhrase(status));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    private String getPropertyName(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastDot = propertyPath.lastIndexOf('.');
        int lastBracket = propertyPath.lastIndexOf('[');
        int lastSeparator = Math.max(lastDot, lastBracket);
        return (lastSeparator == -1) ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    private String getReasonPhrase(HttpStatusCode statusCode) {
        return getReasonPhrase(statusCode, "Status");
    }

    private String getReasonPhrase(HttpStatusCode statusCode, String fallbackTitle) {
        if (statusCode instanceof HttpStatus httpStatus) {
            return httpStatus.getReasonPhrase();
        }
        return fallbackTitle;
    }
}
