package com.studyapp.core.search.model;

import java.util.List;

/**
 * Lower-cased text of one question, ready for matching.
 */
public record SearchableText(
    String questionText,
    List<String> options,
    String explanation,
    List<String> tags
) {}
