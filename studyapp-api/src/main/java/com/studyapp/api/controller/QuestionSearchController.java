package com.studyapp.api.controller;

import com.studyapp.api.dto.request.SearchQuestionsRequest;
import com.studyapp.common.constants.SearchLimits;
import com.studyapp.common.exception.SearchValidationException;
import com.studyapp.core.search.QuestionSearchService;
import com.studyapp.core.search.model.SearchQuery;
import com.studyapp.core.search.model.SearchResponse;
import com.studyapp.core.search.model.SortOption;
import com.studyapp.core.service.QuestionCorpusService;
import com.studyapp.core.service.QuestionLookupService;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.model.QuestionType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/questions")
@RequiredArgsConstructor
@Slf4j
public class QuestionSearchController {
    
    private final QuestionSearchService questionSearchService;
    private final QuestionLookupService questionLookupService;
    private final QuestionCorpusService questionCorpusService;
    
    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @ModelAttribute SearchQuestionsRequest request) {
        return ResponseEntity.ok(questionSearchService.search(toSearchQuery(request)));
    }
    
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> searchWithBody(@Valid @RequestBody SearchQuestionsRequest request) {
        return ResponseEntity.ok(questionSearchService.search(toSearchQuery(request)));
    }
    
    @GetMapping("/{questionId}")
    public ResponseEntity<QuestionRecord> getQuestion(
            @PathVariable String questionId,
            @RequestParam(defaultValue = "true") boolean includeExplanation,
            @RequestParam(defaultValue = "true") boolean includeMetadata
    ) {
        return ResponseEntity.ok(questionLookupService.getQuestion(questionId, includeExplanation, includeMetadata));
    }
    
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int entries = questionCorpusService.cachedEntries();
        questionCorpusService.clearCache();
        log.info("Question cache cleared on request | droppedEntries={}", entries);
        
        Map<String, Object> response = new HashMap<>();
        response.put("status", "CLEARED");
        response.put("droppedEntries", entries);
        return ResponseEntity.ok(response);
    }
    
    private SearchQuery toSearchQuery(SearchQuestionsRequest request) {
        return SearchQuery.builder()
            .query(request.getQuery())
            .provider(emptyToNull(request.getProvider()))
            .exam(emptyToNull(request.getExam()))
            .topic(emptyToNull(request.getTopic()))
            .difficulty(emptyToNull(request.getDifficulty()))
            .type(parseType(request.getType()))
            .tags(request.getTags())
            .sortBy(SortOption.fromValue(request.getSortBy()))
            .limit(request.getLimit() != null ? request.getLimit() : SearchLimits.DEFAULT_LIMIT)
            .offset(request.getOffset() != null ? request.getOffset() : SearchLimits.DEFAULT_OFFSET)
            .includeExplanations(Boolean.TRUE.equals(request.getIncludeExplanations()))
            .includeMetadata(Boolean.TRUE.equals(request.getIncludeMetadata()))
            .highlightMatches(Boolean.TRUE.equals(request.getHighlightMatches()))
            .build();
    }
    
    private QuestionType parseType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return QuestionType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new SearchValidationException("type", e.getMessage());
        }
    }
    
    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
