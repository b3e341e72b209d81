package com.studyapp.core.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.studyapp.common.exception.SearchValidationException;

import java.util.Locale;

public enum SortOption {
    RELEVANCE("relevance"),
    DIFFICULTY_ASC("difficulty_asc"),
    DIFFICULTY_DESC("difficulty_desc"),
    CREATED_ASC("created_asc"),
    CREATED_DESC("created_desc");
    
    private final String value;
    
    SortOption(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Parses a wire value; blank means relevance.
     */
    @JsonCreator
    public static SortOption fromValue(String value) {
        if (value == null || value.isBlank()) {
            return RELEVANCE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortOption option : values()) {
            if (option.value.equals(normalized)) {
                return option;
            }
        }
        throw new SearchValidationException("sortBy", "Unsupported sort option: " + value);
    }
}
