package com.studyapp.core.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Matched substrings per field, for the client to highlight. A null field had no matches.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Highlights {
    List<String> questionText;
    List<String> options;
    List<String> explanation;
    List<String> tags;
    
    public Highlights withoutExplanation() {
        return explanation == null ? this : toBuilder().explanation(null).build();
    }
}
