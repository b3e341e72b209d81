package com.studyapp.core.config;

import com.studyapp.common.constants.SearchLimits;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables for question search. Scoring constants are heuristic; only the
 * ordering questionText >= options >= tags >= explanation is relied upon.
 */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchProperties {
    private int maxQueryLength = SearchLimits.MAX_QUERY_LENGTH;
    private int maxLimit = SearchLimits.MAX_LIMIT;
    private int defaultLimit = SearchLimits.DEFAULT_LIMIT;
    private int maxTerms = SearchLimits.MAX_TERMS;
    private int minTermLength = SearchLimits.MIN_TERM_LENGTH;
    private double minimumScore = 0.1; // Normalized scores below this are treated as no match
    private int highlightCap = SearchLimits.HIGHLIGHT_CAP;
    
    private Scoring scoring = new Scoring();
    private Cache cache = new Cache();
    
    @Getter
    @Setter
    public static class Scoring {
        private double questionTextWeight = 1.0;
        private double optionsWeight = 0.8;
        private double tagsWeight = 0.7;
        private double explanationWeight = 0.5;
        
        private int positionWindow = 50; // Characters at either end of the question text
        private double earlyPositionBonus = 1.2;
        private double latePositionPenalty = 0.8;
        
        private double exactTagMultiplier = 2.5;
        private double fuzzyTagMultiplier = 0.5;
        private int fuzzyCharsPerEdit = 3; // One edit allowed per 3 characters of the term
        
        private double normalizationMultiplier = 2.5;
        private int maxMatchesCollected = 8;
        private int maxMatchesReported = 5;
        
        public double totalWeight() {
            return questionTextWeight + optionsWeight + tagsWeight + explanationWeight;
        }
        
        public boolean hasOrderedWeights() {
            return questionTextWeight >= optionsWeight
                && optionsWeight >= tagsWeight
                && tagsWeight >= explanationWeight
                && explanationWeight >= 0;
        }
    }
    
    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private long ttlMinutes = SearchLimits.DEFAULT_CACHE_TTL_MINUTES;
    }
}
