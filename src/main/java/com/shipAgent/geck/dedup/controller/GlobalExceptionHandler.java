package com.shipAgent.geck.dedup.controller;

import com.shipAgent.geck.dedup.exception.GroupProcessingException;
import com.shipAgent.geck.dedup.exception.InvalidStrategyException;
import com.shipAgent.geck.repository.OperationStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the operations API.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        
        log.warn("Validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }
    
    @ExceptionHandler(InvalidStrategyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStrategy(InvalidStrategyException ex) {
        log.warn("Invalid strategy: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_STRATEGY", ex.getMessage()));
    }
    
    @ExceptionHandler(GroupProcessingException.class)
    public ResponseEntity<ErrorResponse> handleGroupProcessing(GroupProcessingException ex) {
        log.error("Unreadable duplicate group '{}': {}", ex.getGroupName(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("UNPROCESSABLE_GROUP", ex.getMessage()));
    }
    
    @ExceptionHandler(OperationStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(OperationStoreException ex) {
        log.error("Operation store failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORE_UNAVAILABLE", ex.getMessage()));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }
    
    private record ErrorResponse(String code, String message) {}
}
