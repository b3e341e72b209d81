package com.studyapp.api.dto.request;

import com.studyapp.common.constants.SearchLimits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class SearchQuestionsRequest {
    
    @NotBlank(message = "Query is required")
    @Size(max = SearchLimits.MAX_QUERY_LENGTH, message = "Query too long. Maximum 500 characters")
    private String query;
    
    private String provider;
    private String exam;
    private String topic;
    private String difficulty;
    private String type;
    private List<String> tags;
    
    private String sortBy; // relevance, difficulty_asc, difficulty_desc, created_asc, created_desc
    
    @Min(value = SearchLimits.MIN_LIMIT, message = "Limit must be between 1 and 100")
    @Max(value = SearchLimits.MAX_LIMIT, message = "Limit must be between 1 and 100")
    private Integer limit = SearchLimits.DEFAULT_LIMIT;
    
    @Min(value = 0, message = "Offset must be zero or greater")
    private Integer offset = SearchLimits.DEFAULT_OFFSET;
    
    private Boolean includeExplanations = false;
    private Boolean includeMetadata = false;
    private Boolean highlightMatches = false;
}
