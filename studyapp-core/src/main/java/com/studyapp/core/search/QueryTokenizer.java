package com.studyapp.core.search;

import com.studyapp.core.config.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a free-text query into search terms.
 * Word terms keep hyphens and apostrophes; quoted substrings become phrase terms.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryTokenizer {
    
    private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^\\w\\s\"'-]");
    private static final Pattern QUOTED_PHRASE = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    
    private final SearchProperties searchProperties;
    
    /**
     * @return De-duplicated terms, words first then phrases, in query order
     */
    public List<String> tokenize(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        Set<String> terms = new LinkedHashSet<>();
        
        String cleaned = DISALLOWED_CHARS.matcher(lowerQuery).replaceAll(" ");
        for (String word : WHITESPACE.split(cleaned)) {
            addTerm(terms, word.replace("\"", ""));
        }
        
        Matcher phraseMatcher = QUOTED_PHRASE.matcher(lowerQuery);
        while (phraseMatcher.find()) {
            addTerm(terms, WHITESPACE.matcher(phraseMatcher.group(1).trim()).replaceAll(" "));
        }
        
        List<String> result = new ArrayList<>(terms);
        if (result.size() > searchProperties.getMaxTerms()) {
            log.debug("[TOKENIZER] Truncating query terms | found={} | kept={}", result.size(), searchProperties.getMaxTerms());
            result = result.subList(0, searchProperties.getMaxTerms());
        }
        return List.copyOf(result);
    }
    
    private void addTerm(Set<String> terms, String term) {
        // Pure punctuation such as "--" is not a useful term
        if (term.length() >= searchProperties.getMinTermLength() && term.chars().anyMatch(Character::isLetterOrDigit)) {
            terms.add(term);
        }
    }
}
