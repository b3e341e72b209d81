package com.studyapp.api.exception;

import com.studyapp.api.dto.response.ErrorResponse;
import com.studyapp.common.exception.SearchValidationException;
import com.studyapp.core.service.QuestionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<ErrorResponse> handleSearchValidation(
            SearchValidationException ex,
            WebRequest request
    ) {
        log.debug("Rejected search request | field={} | reason={}", ex.getField(), ex.getMessage());
        ErrorResponse errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation failed", ex.getMessage(), request);
        errorResponse.setField(ex.getField());
        return ResponseEntity.badRequest().body(errorResponse);
    }
    
    // MethodArgumentNotValidException is a BindException, so @RequestBody and @ModelAttribute both land here
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            BindException ex,
            WebRequest request
    ) {
        FieldError firstFieldError = ex.getBindingResult().getFieldError();
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError) {
                errors.append(((FieldError) error).getField()).append(": ");
            }
            errors.append(error.getDefaultMessage()).append("; ");
        });
        
        ErrorResponse errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request);
        if (firstFieldError != null) {
            errorResponse.setField(firstFieldError.getField());
        }
        return ResponseEntity.badRequest().body(errorResponse);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        ErrorResponse errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation failed", message, request);
        errorResponse.setField(ex.getName());
        return ResponseEntity.badRequest().body(errorResponse);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", ex.getMostSpecificCause().getMessage(), request);
    }
    
    @ExceptionHandler(QuestionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleQuestionNotFound(
            QuestionNotFoundException ex,
            WebRequest request
    ) {
        return build(HttpStatus.NOT_FOUND, "Question not found", ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }
    
    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String error, WebRequest request) {
        return ResponseEntity.status(status).body(errorBody(status, message, error, request));
    }
    
    private ErrorResponse errorBody(HttpStatus status, String message, String error, WebRequest request) {
        return ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
    }
}
