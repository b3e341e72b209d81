package com.studyapp.core.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.studyapp.data.model.QuestionRecord;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScoredResult {
    @JsonUnwrapped
    QuestionRecord question;
    double relevanceScore;
    Highlights highlights;
    
    /**
     * New result with explanation and metadata cleared as requested.
     * The wrapped record is shared with the corpus cache, so it is copied rather than edited.
     */
    public ScoredResult withFieldSuppression(boolean includeExplanations, boolean includeMetadata) {
        if (includeExplanations && includeMetadata) {
            return this;
        }
        Highlights trimmedHighlights = highlights;
        if (!includeExplanations && highlights != null) {
            trimmedHighlights = highlights.withoutExplanation();
        }
        return ScoredResult.builder()
            .question(question.withOptionalFields(includeExplanations, includeMetadata))
            .relevanceScore(relevanceScore)
            .highlights(trimmedHighlights)
            .build();
    }
}
