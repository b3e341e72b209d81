package com.studyapp.core.search.model;

import com.studyapp.common.constants.SearchLimits;
import com.studyapp.data.model.QuestionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class SearchQuery {
    String query;
    
    // Corpus slice
    String provider;
    String exam;
    
    // Non-text filters
    String topic;
    String difficulty;
    QuestionType type;
    List<String> tags;
    
    @Builder.Default
    SortOption sortBy = SortOption.RELEVANCE;
    
    @Builder.Default
    int limit = SearchLimits.DEFAULT_LIMIT;
    
    @Builder.Default
    int offset = SearchLimits.DEFAULT_OFFSET;
    
    boolean includeExplanations;
    boolean includeMetadata;
    boolean highlightMatches;
    
    public SortOption effectiveSort() {
        return sortBy != null ? sortBy : SortOption.RELEVANCE;
    }
    
    public boolean hasTagFilter() {
        return tags != null && !tags.isEmpty();
    }
}
