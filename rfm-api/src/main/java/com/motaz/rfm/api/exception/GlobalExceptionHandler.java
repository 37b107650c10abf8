package com.motaz.rfm.api.exception;

import com.motaz.rfm.api.dto.ErrorResponseDto;
import com.motaz.rfm.training.exception.ErrorKind;
import com.motaz.rfm.training.exception.SegmentationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String KIND_NOT_FOUND = "NOT_FOUND";
    static final String KIND_INTERNAL = "INTERNAL_ERROR";

    @ExceptionHandler(SegmentationException.class)
    public ResponseEntity<ErrorResponseDto> handleSegmentation(SegmentationException ex) {
        log.warn("Segmentation run rejected, kind: {}, message: {}", ex.getKind(), ex.getMessage());
        HttpStatus status = ex.getKind() == ErrorKind.INVALID_PARAMETER
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return error(status, ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, KIND_NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleValidationException(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETER.name(), "Validation failed: " + errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getAllValidationResults()
                .stream()
                .map(result -> result.getMethodParameter().getParameterName() + ": " + result.getResolvableErrors()
                        .stream()
                        .map(error -> error.getDefaultMessage())
                        .collect(Collectors.joining("; ")))
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETER.name(), "Validation failed: " + errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponseDto> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETER.name(), "Validation failed: " + ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleUnreadableInput(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETER.name(), "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, KIND_INTERNAL, "Internal server error: " + ex.getMessage());
    }

    private static ResponseEntity<ErrorResponseDto> error(HttpStatus status, String kind, String detail) {
        ErrorResponseDto error = ErrorResponseDto.builder()
                .kind(kind)
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
