package com.studyapp.core.search;

import com.studyapp.common.util.TextUtils;
import com.studyapp.core.search.model.FilterOptions;
import com.studyapp.core.search.model.Highlights;
import com.studyapp.core.search.model.PageSlice;
import com.studyapp.core.search.model.ScoreBreakdown;
import com.studyapp.core.search.model.ScoredResult;
import com.studyapp.core.search.model.SearchQuery;
import com.studyapp.core.search.model.SearchResponse;
import com.studyapp.core.service.QuestionCorpusService;
import com.studyapp.data.model.QuestionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Full-text question search: resolve the corpus slice, filter, score, sort, paginate.
 * Scoring runs synchronously over the whole filtered slice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionSearchService {
    
    private final SearchQueryValidator validator;
    private final QuestionCorpusService corpusService;
    private final SearchFilter searchFilter;
    private final QueryTokenizer tokenizer;
    private final SearchableTextExtractor textExtractor;
    private final RelevanceScorer relevanceScorer;
    private final Highlighter highlighter;
    private final ResultSorter resultSorter;
    private final Paginator paginator;
    
    public SearchResponse search(SearchQuery query) {
        validator.validate(query);
        
        long startTime = System.currentTimeMillis();
        String searchId = "search-" + startTime + "-" + Thread.currentThread().getId();
        
        log.info("[SEARCH] Starting search | searchId={} | query={} | provider={} | exam={} | topic={} | difficulty={} | type={} | tags={} | sortBy={} | limit={} | offset={}",
            searchId, TextUtils.preview(query.getQuery(), 50), query.getProvider(), query.getExam(),
            query.getTopic(), query.getDifficulty(), query.getType(), query.getTags(),
            query.effectiveSort(), query.getLimit(), query.getOffset());
        
        // Step 1: Corpus slice (cache or storage)
        long corpusStartTime = System.currentTimeMillis();
        List<QuestionRecord> corpus = corpusService.resolveSlice(query.getProvider(), query.getExam());
        long corpusDuration = System.currentTimeMillis() - corpusStartTime;
        
        // Step 2: Non-text filters and the facets they leave
        List<QuestionRecord> filtered = searchFilter.apply(corpus, query);
        FilterOptions filterOptions = searchFilter.collectOptions(filtered);
        
        // Step 3: Score
        long scoringStartTime = System.currentTimeMillis();
        List<String> terms = tokenizer.tokenize(query.getQuery());
        if (terms.isEmpty()) {
            log.debug("[SEARCH] Query produced no usable terms | searchId={}", searchId);
        }
        List<ScoredResult> matches = scoreAll(filtered, terms, query.isHighlightMatches(), searchId);
        long scoringDuration = System.currentTimeMillis() - scoringStartTime;
        
        // Step 4: Sort and paginate
        List<ScoredResult> sorted = resultSorter.sort(matches, query.effectiveSort());
        PageSlice<ScoredResult> page = paginator.paginate(sorted, query.getOffset(), query.getLimit());
        List<ScoredResult> items = page.getItems().stream()
            .map(result -> result.withFieldSuppression(query.isIncludeExplanations(), query.isIncludeMetadata()))
            .collect(Collectors.toList());
        
        long searchTime = System.currentTimeMillis() - startTime;
        
        log.info("[SEARCH] Search completed | searchId={} | corpusSize={} | filtered={} | terms={} | total={} | returned={} | averageScore={} | totalDurationMs={} | corpus={} | scoring={}",
            searchId, corpus.size(), filtered.size(), terms.size(), page.getTotal(), items.size(),
            String.format("%.3f", averageScore(items)), searchTime, corpusDuration, scoringDuration);
        
        return SearchResponse.builder()
            .items(items)
            .total(page.getTotal())
            .query(query.getQuery())
            .searchTimeMs(searchTime)
            .filters(filterOptions)
            .pagination(SearchResponse.Pagination.builder()
                .limit(page.getLimit())
                .offset(page.getOffset())
                .hasMore(page.isHasMore())
                .build())
            .build();
    }
    
    /**
     * Score every question; malformed or failing records are skipped so the rest
     * of the corpus is still searched.
     */
    private List<ScoredResult> scoreAll(List<QuestionRecord> questions, List<String> terms,
                                        boolean highlightMatches, String searchId) {
        List<QueryTerm> compiledTerms = QueryTerm.compileAll(terms);
        List<ScoredResult> results = new ArrayList<>();
        int skipped = 0;
        
        for (QuestionRecord question : questions) {
            if (!question.isSearchable()) {
                skipped++;
                log.warn("[SEARCH] Skipping malformed question | searchId={} | questionId={}",
                    searchId, question.getQuestionId());
                continue;
            }
            try {
                ScoreBreakdown breakdown = relevanceScorer.scoreCompiled(textExtractor.extract(question), compiledTerms);
                if (!breakdown.isMatch()) {
                    continue;
                }
                Highlights highlights = highlightMatches
                    ? highlighter.highlight(breakdown).orElse(null)
                    : null;
                results.add(ScoredResult.builder()
                    .question(question)
                    .relevanceScore(breakdown.getScore())
                    .highlights(highlights)
                    .build());
            } catch (RuntimeException e) {
                skipped++;
                log.error("[SEARCH] Failed to score question, skipping | searchId={} | questionId={}",
                    searchId, question.getQuestionId(), e);
            }
        }
        
        if (skipped > 0) {
            log.warn("[SEARCH] Questions excluded from scoring | searchId={} | skipped={}", searchId, skipped);
        }
        return results;
    }
    
    private double averageScore(List<ScoredResult> items) {
        return items.stream()
            .mapToDouble(ScoredResult::getRelevanceScore)
            .average()
            .orElse(0);
    }
}
