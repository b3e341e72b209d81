package com.studyapp.core.cache;

public final class CorpusCacheKeys {
    
    public static final String ALL_QUESTIONS = "all-questions";
    
    private CorpusCacheKeys() {}
    
    public static String forProvider(String providerId) {
        return "questions-provider-" + providerId;
    }
    
    public static String forExam(String providerId, String examId) {
        return "questions-exam-" + providerId + "-" + examId;
    }
    
    public static String forQuestion(String questionId) {
        return "question-" + questionId;
    }
    
    /**
     * Key for the slice a search over the given provider/exam filters loads.
     */
    public static String forSlice(String providerId, String examId) {
        if (providerId != null && examId != null) {
            return forExam(providerId, examId);
        }
        if (providerId != null) {
            return forProvider(providerId);
        }
        return ALL_QUESTIONS;
    }
}
