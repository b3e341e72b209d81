package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.TermMatch;
import com.studyapp.core.search.model.TextMatches;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Composes {@link MatchStrategy} constants into field-level matching.
 */
@Component
@RequiredArgsConstructor
public class TermMatcher {
    
    static final List<MatchStrategy> TEXT_STRATEGIES = List.of(
        MatchStrategy.BOUNDARY, MatchStrategy.PARTIAL_WORD, MatchStrategy.SUBSTRING);
    
    private final SearchProperties searchProperties;
    
    /**
     * Run the text strategies in order, keeping distinct matched strings.
     * Collection stops at {@code maxMatchesCollected}; the first {@code maxMatchesReported}
     * are returned while the average position covers everything collected.
     */
    public TextMatches findTextMatches(String text, String term) {
        if (term == null || term.isEmpty()) {
            return TextMatches.none();
        }
        return findTextMatches(text, QueryTerm.compile(term));
    }
    
    public TextMatches findTextMatches(String text, QueryTerm term) {
        if (text == null || text.isEmpty()) {
            return TextMatches.none();
        }
        SearchProperties.Scoring scoring = searchProperties.getScoring();
        List<String> matches = new ArrayList<>();
        long positionSum = 0;
        
        collect:
        for (MatchStrategy strategy : TEXT_STRATEGIES) {
            for (TermMatch match : MatchStrategy.findAll(term.patternFor(strategy), text)) {
                if (matches.size() >= scoring.getMaxMatchesCollected()) {
                    break collect;
                }
                String matchText = match.text().toLowerCase(Locale.ROOT);
                if (!matches.contains(matchText)) {
                    matches.add(matchText);
                    positionSum += match.position();
                }
            }
        }
        
        if (matches.isEmpty()) {
            return TextMatches.none();
        }
        double averagePosition = (double) positionSum / matches.size();
        int reported = Math.min(matches.size(), scoring.getMaxMatchesReported());
        return new TextMatches(List.copyOf(matches.subList(0, reported)), averagePosition);
    }
    
    /**
     * Strongest way a tag matches the term: exact, then substring, then fuzzy.
     */
    public Optional<MatchStrategy> matchTag(String tag, String term) {
        if (term == null || term.isEmpty()) {
            return Optional.empty();
        }
        return matchTag(tag, QueryTerm.compile(term));
    }
    
    public Optional<MatchStrategy> matchTag(String tag, QueryTerm term) {
        if (tag == null || tag.isEmpty()) {
            return Optional.empty();
        }
        if (MatchStrategy.EXACT.matches(tag, term.text())) {
            return Optional.of(MatchStrategy.EXACT);
        }
        if (!MatchStrategy.findAll(term.patternFor(MatchStrategy.SUBSTRING), tag).isEmpty()) {
            return Optional.of(MatchStrategy.SUBSTRING);
        }
        if (MatchStrategy.isFuzzyMatch(tag, term.text(), searchProperties.getScoring().getFuzzyCharsPerEdit())) {
            return Optional.of(MatchStrategy.FUZZY);
        }
        return Optional.empty();
    }
}
