package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import com.studyapp.core.search.model.TextMatches;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TermMatcherTest {

    private final TermMatcher termMatcher = new TermMatcher(new SearchProperties());

    @Test
    void collectsDistinctMatchesAcrossStrategies() {
        TextMatches matches = termMatcher.findTextMatches("instance instances instance", "instance");

        assertEquals(List.of("instance", "instances"), matches.matches());
        assertEquals(4.5, matches.averagePosition(), 1e-9);
    }

    @Test
    void stopsCollectingAfterEightAndReportsFive() {
        TextMatches matches = termMatcher.findTextMatches("ab1 ab2 ab3 ab4 ab5 ab6 ab7 ab8 ab9 ab10", "ab");

        assertEquals(List.of("ab1", "ab2", "ab3", "ab4", "ab5"), matches.matches());
        // positions 0, 4, ..., 28 of the eight collected words
        assertEquals(14.0, matches.averagePosition(), 1e-9);
    }

    @Test
    void precompiledTerm_reusedAcrossTexts() {
        QueryTerm term = QueryTerm.compile("ec2");

        assertEquals(List.of("ec2"), termMatcher.findTextMatches("what is an ec2 instance", term).matches());
        assertEquals(List.of("ec2"), termMatcher.findTextMatches("ec2 pricing", term).matches());
        assertEquals(Optional.of(MatchStrategy.SUBSTRING), termMatcher.matchTag("amazon-ec2", term));
    }

    @Test
    void emptyInputs_matchNothing() {
        assertTrue(termMatcher.findTextMatches("", "ec2").isEmpty());
        assertTrue(termMatcher.findTextMatches(null, "ec2").isEmpty());
        assertTrue(termMatcher.findTextMatches("ec2", "").isEmpty());
    }

    @Test
    void matchTag_prefersStrongestStrategy() {
        assertEquals(Optional.of(MatchStrategy.EXACT), termMatcher.matchTag("ec2", "ec2"));
        assertEquals(Optional.of(MatchStrategy.SUBSTRING), termMatcher.matchTag("amazon-ec2", "ec2"));
        assertEquals(Optional.of(MatchStrategy.FUZZY), termMatcher.matchTag("ecs", "eks"));
        assertEquals(Optional.empty(), termMatcher.matchTag("lambda", "eks"));
    }

    @Test
    void matchTag_usesConfiguredEditBudget() {
        SearchProperties properties = new SearchProperties();
        properties.getScoring().setFuzzyCharsPerEdit(10);
        TermMatcher strict = new TermMatcher(properties);

        assertEquals(Optional.empty(), strict.matchTag("ecs", "eks"));
    }
}
