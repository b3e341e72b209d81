package com.studyapp.data.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one exam question as stored in the question corpus.
 * Instances are shared between cached corpus slices and concurrent searches,
 * so they are never mutated; use {@code toBuilder()} to derive a variant.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionRecord {
    String questionId;
    String providerId;
    String examId;
    String topicId;
    String questionText;
    List<String> options;
    
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    List<String> correctAnswer;
    
    String explanation;
    List<String> tags;
    String difficulty;
    QuestionType type;
    
    Map<String, Object> metadata;
    
    Instant createdAt;
    Instant updatedAt;
    
    /**
     * A record can be scored only when it has an id, question text and options.
     */
    public boolean isSearchable() {
        return questionId != null && !questionId.isBlank()
            && questionText != null && !questionText.isBlank()
            && options != null;
    }
    
    /**
     * Type with the corpus default applied.
     */
    public QuestionType effectiveType() {
        return type != null ? type : QuestionType.MULTIPLE_CHOICE;
    }
    
    /**
     * Copy of this record with the explanation and/or metadata cleared.
     */
    public QuestionRecord withOptionalFields(boolean includeExplanation, boolean includeMetadata) {
        if (includeExplanation && includeMetadata) {
            return this;
        }
        QuestionRecordBuilder builder = toBuilder();
        if (!includeExplanation) {
            builder.explanation(null);
        }
        if (!includeMetadata) {
            builder.metadata(Map.of());
        }
        return builder.build();
    }
}
