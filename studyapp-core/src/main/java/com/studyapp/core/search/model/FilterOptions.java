package com.studyapp.core.search.model;

import com.studyapp.data.model.QuestionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Distinct filter values present in a corpus slice, for facet rendering.
 */
@Value
@Builder
public class FilterOptions {
    List<String> providers;
    List<String> exams;
    List<String> topics;
    List<String> difficulties;
    List<QuestionType> types;
    List<String> tags;
    
    public static FilterOptions empty() {
        return FilterOptions.builder()
            .providers(List.of())
            .exams(List.of())
            .topics(List.of())
            .difficulties(List.of())
            .types(List.of())
            .tags(List.of())
            .build();
    }
}
