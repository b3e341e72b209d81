package com.studyapp.core.search.model;

import java.util.List;

/**
 * Distinct matches of one term in one text field, with the average start
 * position of every collected match.
 */
public record TextMatches(List<String> matches, double averagePosition) {
    
    private static final TextMatches NONE = new TextMatches(List.of(), 0);
    
    public static TextMatches none() {
        return NONE;
    }
    
    public boolean isEmpty() {
        return matches.isEmpty();
    }
    
    public int count() {
        return matches.size();
    }
}
