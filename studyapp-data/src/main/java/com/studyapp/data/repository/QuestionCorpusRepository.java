package com.studyapp.data.repository;

import com.studyapp.data.model.QuestionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the raw question corpus.
 * Implementations may read from local files, object storage, etc.
 */
public interface QuestionCorpusRepository {
    
    /**
     * Load the questions for a provider/exam slice.
     * @param providerId Provider to load, or null for every provider
     * @param examId Exam within the provider, or null for every exam of the provider
     * @return Questions in corpus order
     * @throws CorpusNotFoundException if the provider or exam does not exist
     */
    List<QuestionRecord> fetchCorpusSlice(String providerId, String examId);
    
    /**
     * Find a single question by its identifier.
     */
    Optional<QuestionRecord> fetchQuestionById(String questionId);
}
