package com.studyapp.core.search.model;

/**
 * Question fields that take part in relevance scoring.
 */
public enum SearchField {
    QUESTION_TEXT,
    OPTIONS,
    TAGS,
    EXPLANATION
}
