package com.planit.gamification.controller;

import com.planit.gamification.dto.ApiResponse;
import com.planit.gamification.exception.GamificationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps gamification errors to {@link ApiResponse} error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GamificationExceptionHandler {

    @ExceptionHandler(GamificationException.class)
    public ResponseEntity<ApiResponse<Void>> handleGamificationException(GamificationException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Gamification error: errorId={}, errorCode={}", ex.getErrorId(), ex.getErrorCode(), ex);
        } else {
            log.warn("Gamification request rejected: errorId={}, errorCode={}, message={}",
                    ex.getErrorId(), ex.getErrorCode(), ex.getMessage());
        }
        ApiResponse<Void> body = ApiResponse.error(ex.getMessage(), ex.getErrorCode());
        body.setErrorId(ex.getErrorId());
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationErrors(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " " + ex.getBindingResult().getFieldError(field).getDefaultMessage())
                .distinct()
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ApiResponse.error(message, "VALIDATION_FAILED"));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException ex) {
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getMessage(), "VALIDATION_FAILED"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getMessage(), "INVALID_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR"));
    }
}
