package com.studyapp.core.service;

import com.studyapp.common.exception.SearchValidationException;
import com.studyapp.data.model.QuestionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionLookupService {
    
    private final QuestionCorpusService corpusService;
    
    public QuestionRecord getQuestion(String questionId, boolean includeExplanation, boolean includeMetadata) {
        if (questionId == null || questionId.isBlank()) {
            throw new SearchValidationException("questionId", "Question ID is required");
        }
        log.info("[LOOKUP] Getting question | questionId={} | includeExplanation={} | includeMetadata={}",
            questionId, includeExplanation, includeMetadata);
        
        QuestionRecord question = corpusService.resolveQuestion(questionId)
            .orElseThrow(() -> new QuestionNotFoundException(questionId));
        return question.withOptionalFields(includeExplanation, includeMetadata);
    }
}
