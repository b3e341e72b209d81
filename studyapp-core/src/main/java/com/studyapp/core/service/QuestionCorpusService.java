package com.studyapp.core.service;

import com.studyapp.core.cache.CorpusCache;
import com.studyapp.core.cache.CorpusCacheKeys;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.repository.CorpusNotFoundException;
import com.studyapp.data.repository.QuestionCorpusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Resolves corpus slices and single questions, cache first.
 * An unavailable corpus degrades to an empty slice instead of failing the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionCorpusService {
    
    private final QuestionCorpusRepository corpusRepository;
    private final CorpusCache corpusCache;
    
    public List<QuestionRecord> resolveSlice(String providerId, String examId) {
        String cacheKey = CorpusCacheKeys.forSlice(providerId, examId);
        Optional<List<QuestionRecord>> cached = corpusCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("[CORPUS] Cache hit | key={} | questions={}", cacheKey, cached.get().size());
            return cached.get();
        }
        
        long startTime = System.currentTimeMillis();
        List<QuestionRecord> loaded;
        try {
            loaded = corpusRepository.fetchCorpusSlice(providerId, examId);
        } catch (CorpusNotFoundException e) {
            log.warn("[CORPUS] No question data, treating as empty corpus | providerId={} | examId={} | reason={}",
                providerId, examId, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("[CORPUS] Corpus unavailable, treating as empty corpus | providerId={} | examId={} | error={}",
                providerId, examId, e.getMessage(), e);
            return List.of();
        }
        
        List<QuestionRecord> snapshot = loaded == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(loaded));
        corpusCache.put(cacheKey, snapshot);
        
        log.info("[CORPUS] Loaded corpus slice | key={} | questions={} | durationMs={}",
            cacheKey, snapshot.size(), System.currentTimeMillis() - startTime);
        return snapshot;
    }
    
    public Optional<QuestionRecord> resolveQuestion(String questionId) {
        String cacheKey = CorpusCacheKeys.forQuestion(questionId);
        Optional<QuestionRecord> cached = corpusCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("[CORPUS] Cache hit | key={}", cacheKey);
            return cached;
        }
        
        // A warm full-corpus slice saves a storage walk
        Optional<List<QuestionRecord>> allQuestions = corpusCache.get(CorpusCacheKeys.ALL_QUESTIONS);
        Optional<QuestionRecord> question = allQuestions.flatMap(questions -> questions.stream()
            .filter(q -> q != null && questionId.equals(q.getQuestionId()))
            .findFirst());
        
        if (question.isEmpty()) {
            try {
                question = corpusRepository.fetchQuestionById(questionId);
            } catch (RuntimeException e) {
                log.warn("[CORPUS] Question lookup failed | questionId={} | error={}", questionId, e.getMessage(), e);
                return Optional.empty();
            }
        }
        
        question.ifPresent(q -> corpusCache.put(cacheKey, q));
        return question;
    }
    
    public void clearCache() {
        corpusCache.clear();
    }
    
    public int cachedEntries() {
        return corpusCache.size();
    }
}
