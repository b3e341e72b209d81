package com.studyapp.core.search;

import com.studyapp.core.search.model.TermMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ways a search term can match a piece of lower-cased question text.
 * Each strategy is a pure function of (text, term). The text strategies also expose
 * their compiled {@link Pattern} so a term can be compiled once per search.
 */
public enum MatchStrategy {
    
    /** Whole-word occurrences of the term. */
    BOUNDARY {
        @Override
        public Pattern compile(String term) {
            return Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE);
        }
    },
    
    /** Words that contain the term, e.g. "instance" in "instances". */
    PARTIAL_WORD {
        @Override
        public Pattern compile(String term) {
            return Pattern.compile("\\b\\w*" + Pattern.quote(term) + "\\w*\\b", Pattern.CASE_INSENSITIVE);
        }
    },
    
    /** Raw occurrences anywhere, for technical terms like "s3" inside "s3-bucket". */
    SUBSTRING {
        @Override
        public Pattern compile(String term) {
            return Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE);
        }
    },
    
    /** The whole text equals the term. */
    EXACT {
        @Override
        public List<TermMatch> find(String text, String term) {
            return text.equals(term) ? List.of(new TermMatch(text, 0)) : List.of();
        }
    },
    
    /**
     * The whole text is within a small edit distance of the term: at most one edit
     * per three characters of the term, and the text is not shorter than the term.
     */
    FUZZY {
        @Override
        public List<TermMatch> find(String text, String term) {
            return isFuzzyMatch(text, term, DEFAULT_CHARS_PER_EDIT) ? List.of(new TermMatch(text, 0)) : List.of();
        }
    };
    
    public static final int DEFAULT_CHARS_PER_EDIT = 3;
    
    public List<TermMatch> find(String text, String term) {
        return findAll(compile(term), text);
    }
    
    public boolean matches(String text, String term) {
        return !find(text, term).isEmpty();
    }
    
    /**
     * Pattern for the text strategies; whole-value strategies have none.
     */
    public Pattern compile(String term) {
        throw new UnsupportedOperationException(name() + " compares whole values and has no pattern");
    }
    
    /**
     * Non-empty occurrences of an already compiled term pattern.
     */
    public static List<TermMatch> findAll(Pattern pattern, String text) {
        List<TermMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            matches.add(new TermMatch(matcher.group(), matcher.start()));
        }
        return matches;
    }
    
    public static boolean isFuzzyMatch(String text, String term, int charsPerEdit) {
        if (text.length() < term.length()) {
            return false;
        }
        int maxDistance = term.length() / charsPerEdit;
        if (text.length() - term.length() > maxDistance) {
            return false; // Length gap alone exceeds the allowed edits
        }
        return levenshteinDistance(text, term) <= maxDistance;
    }
    
    static int levenshteinDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
