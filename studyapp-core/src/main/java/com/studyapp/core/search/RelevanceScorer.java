package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.ScoreBreakdown;
import com.studyapp.core.search.model.SearchField;
import com.studyapp.core.search.model.SearchableText;
import com.studyapp.core.search.model.TextMatches;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field-weighted relevance scoring of one question against the query terms.
 *
 * Per term:
 * - question text: matches x weight x positional multiplier (early bonus, late penalty)
 * - options: matches x weight, summed over every option
 * - tags: exact, substring or fuzzy match, each worth a different share of the tag weight
 * - explanation: matches x weight
 *
 * The total is scaled by term coverage (0.5 + 0.5 x matched/total), divided by the
 * best achievable score for the term count and clamped to [0, 1]. Scores under
 * the configured minimum are reported as 0.
 */
@Component
@Slf4j
public class RelevanceScorer {
    
    private final SearchProperties searchProperties;
    private final TermMatcher termMatcher;
    
    public RelevanceScorer(SearchProperties searchProperties, TermMatcher termMatcher) {
        if (!searchProperties.getScoring().hasOrderedWeights()) {
            throw new IllegalStateException(
                "Search weights must satisfy questionText >= options >= tags >= explanation >= 0");
        }
        this.searchProperties = searchProperties;
        this.termMatcher = termMatcher;
    }
    
    public ScoreBreakdown score(SearchableText text, List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return ScoreBreakdown.empty(0);
        }
        return scoreCompiled(text, QueryTerm.compileAll(terms));
    }
    
    /**
     * Same as {@link #score} for terms already compiled by the caller, typically once per search.
     */
    public ScoreBreakdown scoreCompiled(SearchableText text, List<QueryTerm> terms) {
        if (terms == null || terms.isEmpty()) {
            return ScoreBreakdown.empty(0);
        }
        SearchProperties.Scoring scoring = searchProperties.getScoring();
        Map<SearchField, List<String>> fieldMatches = new EnumMap<>(SearchField.class);
        for (SearchField field : SearchField.values()) {
            fieldMatches.put(field, new ArrayList<>());
        }
        
        double totalScore = 0;
        int matchedTerms = 0;
        
        for (QueryTerm term : terms) {
            double termScore = 0;
            boolean termMatched = false;
            
            TextMatches questionMatches = termMatcher.findTextMatches(text.questionText(), term);
            if (!questionMatches.isEmpty()) {
                double positional = positionalMultiplier(questionMatches.averagePosition(), text.questionText().length());
                termScore += questionMatches.count() * scoring.getQuestionTextWeight() * positional;
                fieldMatches.get(SearchField.QUESTION_TEXT).addAll(questionMatches.matches());
                termMatched = true;
            }
            
            for (String option : text.options()) {
                TextMatches optionMatches = termMatcher.findTextMatches(option, term);
                if (!optionMatches.isEmpty()) {
                    termScore += optionMatches.count() * scoring.getOptionsWeight();
                    fieldMatches.get(SearchField.OPTIONS).addAll(optionMatches.matches());
                    termMatched = true;
                }
            }
            
            for (String tag : text.tags()) {
                Optional<MatchStrategy> tagMatch = termMatcher.matchTag(tag, term);
                if (tagMatch.isPresent()) {
                    termScore += tagScore(tagMatch.get(), scoring);
                    fieldMatches.get(SearchField.TAGS).add(tag);
                    termMatched = true;
                }
            }
            
            TextMatches explanationMatches = termMatcher.findTextMatches(text.explanation(), term);
            if (!explanationMatches.isEmpty()) {
                termScore += explanationMatches.count() * scoring.getExplanationWeight();
                fieldMatches.get(SearchField.EXPLANATION).addAll(explanationMatches.matches());
                termMatched = true;
            }
            
            totalScore += termScore;
            if (termMatched) {
                matchedTerms++;
            }
        }
        
        double coverage = (double) matchedTerms / terms.size();
        double rawScore = totalScore * (0.5 + 0.5 * coverage);
        
        double maxPossibleScore = terms.size() * scoring.totalWeight() * scoring.getNormalizationMultiplier();
        double normalized = maxPossibleScore > 0 ? Math.min(rawScore / maxPossibleScore, 1.0) : 0;
        if (normalized < searchProperties.getMinimumScore()) {
            normalized = 0;
        }
        
        return ScoreBreakdown.builder()
            .rawScore(rawScore)
            .score(normalized)
            .matchedTerms(matchedTerms)
            .totalTerms(terms.size())
            .fieldMatches(freeze(fieldMatches))
            .build();
    }
    
    /**
     * Multiplier for question-text matches based on where they occur on average.
     */
    double positionalMultiplier(double averagePosition, int textLength) {
        SearchProperties.Scoring scoring = searchProperties.getScoring();
        if (averagePosition < scoring.getPositionWindow()) {
            return scoring.getEarlyPositionBonus();
        }
        if (averagePosition > textLength - scoring.getPositionWindow()) {
            return scoring.getLatePositionPenalty();
        }
        return 1.0;
    }
    
    private double tagScore(MatchStrategy strategy, SearchProperties.Scoring scoring) {
        switch (strategy) {
            case EXACT:
                return scoring.getExactTagMultiplier() * scoring.getTagsWeight();
            case FUZZY:
                return scoring.getFuzzyTagMultiplier() * scoring.getTagsWeight();
            default:
                return scoring.getTagsWeight();
        }
    }
    
    private Map<SearchField, List<String>> freeze(Map<SearchField, List<String>> fieldMatches) {
        Map<SearchField, List<String>> frozen = new EnumMap<>(SearchField.class);
        fieldMatches.forEach((field, matches) -> frozen.put(field, List.copyOf(matches)));
        return Collections.unmodifiableMap(frozen);
    }
}
