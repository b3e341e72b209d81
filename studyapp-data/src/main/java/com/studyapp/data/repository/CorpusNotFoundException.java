package com.studyapp.data.repository;

/**
 * Raised by a {@link QuestionCorpusRepository} when a provider or exam has no question data.
 */
public class CorpusNotFoundException extends RuntimeException {
    
    public CorpusNotFoundException(String message) {
        super(message);
    }
}
