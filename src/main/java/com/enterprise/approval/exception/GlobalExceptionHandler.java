package com.enterprise.approval.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.enterprise.approval.dto.response.ApiResponse;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the application.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

        @ExceptionHandler(WorkflowValidationException.class)
        public ResponseEntity<ApiResponse<Map<String, List<String>>>> handleWorkflowValidation(
                        WorkflowValidationException ex, HttpServletRequest request) {
                log.warn("Workflow validation failed: {}", ex.getErrors());
                return ResponseEntity.status(ex.getStatus())
                                .body(ApiResponse.error(ex.getErrorCode(), "Workflow validation failed",
                                                Map.of("errors", ex.getErrors()), request.getRequestURI()));
        }

        @ExceptionHandler(ApprovalWorkflowException.class)
        public ResponseEntity<ApiResponse<Void>> handleApprovalWorkflowException(
                        ApprovalWorkflowException ex, HttpServletRequest request) {
                if (ex.getStatus().is5xxServerError()) {
                        log.error("Approval workflow error [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
                } else {
                        log.warn("Approval workflow refused [{}]: {}", ex.getErrorCode(), ex.getMessage());
                }
                return ResponseEntity.status(ex.getStatus())
                                .body(ApiResponse.error(ex.getErrorCode(), ex.getMessage(), null,
                                                request.getRequestURI()));
        }

        @ExceptionHandler(AccessDeniedException.class)
        public ResponseEntity<ApiResponse<Void>> handleAccessDenied(
                        AccessDeniedException ex, HttpServletRequest request) {
                log.warn("Access denied: {}", ex.getMessage());
                return ResponseEntity.status(HttpStatus.FORBIDDEN)
                                .body(ApiResponse.error("ACCESS_DENIED", "Access denied: " + ex.getMessage(), null,
                                                request.getRequestURI()));
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ApiResponse<Map<String, String>>> handleValidationErrors(
                        MethodArgumentNotValidException ex, HttpServletRequest request) {
                Map<String, String> errors = new LinkedHashMap<>();
                ex.getBindingResult().getAllErrors().forEach(error -> {
                        String fieldName = error instanceof FieldError fieldError
                                        ? fieldError.getField()
                                        : error.getObjectName();
                        errors.put(fieldName, error.getDefaultMessage());
                });

                log.warn("Validation failed: {}", errors);

                ApiResponse<Map<String, String>> response = ApiResponse.<Map<String, String>>builder()
                                .success(false)
                                .errorCode("VALIDATION_FAILED")
                                .message("Validation failed")
                                .data(errors)
                                .path(request.getRequestURI())
                                .build();

                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        }

        @ExceptionHandler(HandlerMethodValidationException.class)
        public ResponseEntity<ApiResponse<Void>> handleParameterValidation(
                        HandlerMethodValidationException ex, HttpServletRequest request) {
                log.warn("Parameter validation failed: {}", ex.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                                .body(ApiResponse.error("VALIDATION_FAILED", "Invalid request parameters", null,
                                                request.getRequestURI()));
        }

        @ExceptionHandler(MissingServletRequestParameterException.class)
        public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
                        MissingServletRequestParameterException ex, HttpServletRequest request) {
                log.warn("Missing parameter: {}", ex.getParameterName());
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                                .body(ApiResponse.error("VALIDATION_FAILED",
                                                "Missing required parameter: " + ex.getParameterName(), null,
                                                request.getRequestURI()));
        }

        @ExceptionHandler(HttpMessageNotReadableException.class)
        public ResponseEntity<ApiResponse<Void>> handleUnreadableMessage(
                        HttpMessageNotReadableException ex, HttpServletRequest request) {
                log.warn("Malformed request body: {}", ex.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                                .body(ApiResponse.error("MALFORMED_REQUEST", "Malformed request body", null,
                                                request.getRequestURI()));
        }

        @ExceptionHandler(MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
                        MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
                String message = String.format("Invalid value '%s' for parameter '%s'",
                                ex.getValue(), ex.getName());
                log.warn("Type mismatch: {}", message);
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                                .body(ApiResponse.error(message, request.getRequestURI()));
        }

        @ExceptionHandler(IllegalArgumentException.class)
        public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(
                        IllegalArgumentException ex, HttpServletRequest request) {
                log.warn("Illegal argument: {}", ex.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                                .body(ApiResponse.error(ex.getMessage(), request.getRequestURI()));
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<Void> handleNoResourceFound(
                        NoResourceFoundException ex, HttpServletRequest request) {
                log.debug("Resource not found: {}", request.getRequestURI());
                return ResponseEntity.notFound().build();
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ApiResponse<Void>> handleGenericException(
                        Exception ex, HttpServletRequest request) {
                log.error("Unexpected error occurred", ex);
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                                .body(ApiResponse.error("An unexpected error occurred. Please try again later.",
                                                request.getRequestURI()));
        }
}
