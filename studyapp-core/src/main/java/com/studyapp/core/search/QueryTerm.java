package com.studyapp.core.search;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A search term with its text-strategy patterns compiled once per search,
 * so scoring a corpus does not recompile them for every record.
 */
public record QueryTerm(String text, Map<MatchStrategy, Pattern> patterns) {
    
    public static QueryTerm compile(String term) {
        Map<MatchStrategy, Pattern> patterns = new EnumMap<>(MatchStrategy.class);
        for (MatchStrategy strategy : TermMatcher.TEXT_STRATEGIES) {
            patterns.put(strategy, strategy.compile(term));
        }
        return new QueryTerm(term, Collections.unmodifiableMap(patterns));
    }
    
    public static List<QueryTerm> compileAll(List<String> terms) {
        return terms.stream().map(QueryTerm::compile).collect(Collectors.toUnmodifiableList());
    }
    
    public Pattern patternFor(MatchStrategy strategy) {
        Pattern pattern = patterns.get(strategy);
        if (pattern == null) {
            throw new IllegalArgumentException(strategy + " has no compiled pattern");
        }
        return pattern;
    }
}
