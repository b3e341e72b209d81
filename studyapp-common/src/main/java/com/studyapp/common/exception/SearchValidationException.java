package com.studyapp.common.exception;

/**
 * Thrown when a search request is rejected before any scoring happens.
 */
public class SearchValidationException extends RuntimeException {
    
    private final String field;
    
    public SearchValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
