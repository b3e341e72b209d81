package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.Highlights;
import com.studyapp.core.search.model.ScoreBreakdown;
import com.studyapp.core.search.model.SearchField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class Highlighter {
    
    private final SearchProperties searchProperties;
    
    /**
     * Build highlights from a scored match. Text fields are capped, tags are not.
     * @return empty when the breakdown is not a match or nothing matched
     */
    public Optional<Highlights> highlight(ScoreBreakdown breakdown) {
        if (breakdown == null || !breakdown.isMatch()) {
            return Optional.empty();
        }
        int cap = searchProperties.getHighlightCap();
        Highlights highlights = Highlights.builder()
            .questionText(distinct(breakdown.matchesFor(SearchField.QUESTION_TEXT), cap))
            .options(distinct(breakdown.matchesFor(SearchField.OPTIONS), cap))
            .explanation(distinct(breakdown.matchesFor(SearchField.EXPLANATION), cap))
            .tags(distinct(breakdown.matchesFor(SearchField.TAGS), Integer.MAX_VALUE))
            .build();
        
        if (highlights.getQuestionText() == null && highlights.getOptions() == null
                && highlights.getExplanation() == null && highlights.getTags() == null) {
            return Optional.empty();
        }
        return Optional.of(highlights);
    }
    
    private List<String> distinct(List<String> matches, int cap) {
        if (matches.isEmpty()) {
            return null;
        }
        return new LinkedHashSet<>(matches.stream()
                .map(match -> match.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList()))
            .stream()
            .limit(cap)
            .collect(Collectors.toUnmodifiableList());
    }
}
