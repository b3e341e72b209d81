package com.studyapp.core.search;

import com.studyapp.common.exception.SearchValidationException;
import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.SearchQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed search requests before any corpus access or scoring.
 * Values are never coerced into range.
 */
@Component
@RequiredArgsConstructor
public class SearchQueryValidator {
    
    private final SearchProperties searchProperties;
    
    public void validate(SearchQuery query) {
        if (query == null) {
            throw new SearchValidationException("query", "Search request is required");
        }
        String text = query.getQuery();
        if (text == null || text.trim().isEmpty()) {
            throw new SearchValidationException("query", "Query is required and must be a non-empty string");
        }
        if (text.length() > searchProperties.getMaxQueryLength()) {
            throw new SearchValidationException("query",
                "Query too long. Maximum " + searchProperties.getMaxQueryLength() + " characters");
        }
        if (query.getLimit() < 1 || query.getLimit() > searchProperties.getMaxLimit()) {
            throw new SearchValidationException("limit",
                "Limit must be between 1 and " + searchProperties.getMaxLimit());
        }
        if (query.getOffset() < 0) {
            throw new SearchValidationException("offset", "Offset must be zero or greater");
        }
        if (query.getTags() != null && query.getTags().stream().anyMatch(tag -> tag == null || tag.isBlank())) {
            throw new SearchValidationException("tags", "Tags must be non-empty strings");
        }
    }
}
