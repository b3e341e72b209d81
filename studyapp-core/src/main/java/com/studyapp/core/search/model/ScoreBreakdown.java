package com.studyapp.core.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ScoreBreakdown {
    double rawScore;
    double score; // normalized to [0, 1], 0 means no match
    int matchedTerms;
    int totalTerms;
    Map<SearchField, List<String>> fieldMatches;
    
    public boolean isMatch() {
        return score > 0;
    }
    
    public List<String> matchesFor(SearchField field) {
        return fieldMatches.getOrDefault(field, List.of());
    }
    
    public static ScoreBreakdown empty(int totalTerms) {
        return ScoreBreakdown.builder()
            .rawScore(0)
            .score(0)
            .matchedTerms(0)
            .totalTerms(totalTerms)
            .fieldMatches(Map.of())
            .build();
    }
}
