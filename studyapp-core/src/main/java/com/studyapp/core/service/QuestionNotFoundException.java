package com.studyapp.core.service;

public class QuestionNotFoundException extends RuntimeException {
    
    private final String questionId;
    
    public QuestionNotFoundException(String questionId) {
        super("Question not found: " + questionId);
        this.questionId = questionId;
    }
    
    public String getQuestionId() {
        return questionId;
    }
}
