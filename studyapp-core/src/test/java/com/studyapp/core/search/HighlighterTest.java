package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.Highlights;
import com.studyapp.core.search.model.ScoreBreakdown;
import com.studyapp.core.search.model.SearchField;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class HighlighterTest {

    private final Highlighter highlighter = new Highlighter(new SearchProperties());

    private ScoreBreakdown breakdown(double score, Map<SearchField, List<String>> fieldMatches) {
        return ScoreBreakdown.builder()
            .rawScore(score * 7.5)
            .score(score)
            .matchedTerms(1)
            .totalTerms(1)
            .fieldMatches(fieldMatches)
            .build();
    }

    private List<String> words(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> prefix + i).collect(Collectors.toList());
    }

    @Test
    void capsTextFieldsButNotTags() {
        Map<SearchField, List<String>> matches = new EnumMap<>(SearchField.class);
        matches.put(SearchField.QUESTION_TEXT, words("word", 12));
        matches.put(SearchField.OPTIONS, words("option", 11));
        matches.put(SearchField.TAGS, words("tag", 12));

        Highlights highlights = highlighter.highlight(breakdown(0.5, matches)).orElseThrow();

        assertEquals(10, highlights.getQuestionText().size());
        assertEquals("word0", highlights.getQuestionText().get(0));
        assertEquals(10, highlights.getOptions().size());
        assertEquals(12, highlights.getTags().size());
        assertNull(highlights.getExplanation());
    }

    @Test
    void deduplicatesCaseInsensitively() {
        Map<SearchField, List<String>> matches = new EnumMap<>(SearchField.class);
        matches.put(SearchField.QUESTION_TEXT, List.of("EC2", "ec2", "instance"));
        matches.put(SearchField.TAGS, List.of("ec2", "ec2"));

        Highlights highlights = highlighter.highlight(breakdown(0.3, matches)).orElseThrow();

        assertEquals(List.of("ec2", "instance"), highlights.getQuestionText());
        assertEquals(List.of("ec2"), highlights.getTags());
    }

    @Test
    void nonMatchingBreakdown_hasNoHighlights() {
        Map<SearchField, List<String>> matches = new EnumMap<>(SearchField.class);
        matches.put(SearchField.TAGS, List.of("ecs"));

        assertEquals(Optional.empty(), highlighter.highlight(breakdown(0, matches)));
        assertEquals(Optional.empty(), highlighter.highlight(breakdown(0.4, Map.of())));
        assertEquals(Optional.empty(), highlighter.highlight(null));
    }

    @Test
    void withoutExplanation_dropsOnlyExplanation() {
        Highlights highlights = Highlights.builder()
            .questionText(List.of("ec2"))
            .explanation(List.of("ec2"))
            .build();

        Highlights trimmed = highlights.withoutExplanation();

        assertNull(trimmed.getExplanation());
        assertEquals(List.of("ec2"), trimmed.getQuestionText());
        assertEquals(List.of("ec2"), highlights.getExplanation());
    }
}
