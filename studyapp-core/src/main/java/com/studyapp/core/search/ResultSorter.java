package com.studyapp.core.search;

import com.studyapp.core.search.model.ScoredResult;
import com.studyapp.core.search.model.SortOption;
import com.studyapp.data.model.DifficultyLevel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders search results. {@link List#sort} is stable, so results with equal keys
 * keep their corpus order.
 */
@Component
public class ResultSorter {
    
    private static final Comparator<ScoredResult> BY_RELEVANCE =
        Comparator.comparingDouble(ScoredResult::getRelevanceScore).reversed();
    
    private static final Comparator<ScoredResult> BY_DIFFICULTY =
        Comparator.comparingInt(result -> DifficultyLevel.rankOf(result.getQuestion().getDifficulty()));
    
    private static final Comparator<ScoredResult> BY_CREATED_AT =
        Comparator.comparing(ResultSorter::createdAtOrEarliest);
    
    public List<ScoredResult> sort(List<ScoredResult> results, SortOption sortBy) {
        List<ScoredResult> sorted = new ArrayList<>(results);
        sorted.sort(comparatorFor(sortBy));
        return sorted;
    }
    
    Comparator<ScoredResult> comparatorFor(SortOption sortBy) {
        if (sortBy == null) {
            return BY_RELEVANCE;
        }
        switch (sortBy) {
            case DIFFICULTY_ASC:
                return BY_DIFFICULTY;
            case DIFFICULTY_DESC:
                return BY_DIFFICULTY.reversed();
            case CREATED_ASC:
                return BY_CREATED_AT;
            case CREATED_DESC:
                return BY_CREATED_AT.reversed();
            case RELEVANCE:
            default:
                return BY_RELEVANCE;
        }
    }
    
    private static Instant createdAtOrEarliest(ScoredResult result) {
        Instant createdAt = result.getQuestion().getCreatedAt();
        return createdAt != null ? createdAt : Instant.MIN;
    }
}
