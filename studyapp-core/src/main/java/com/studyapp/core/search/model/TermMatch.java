package com.studyapp.core.search.model;

/**
 * One occurrence of a search term: the matched text and where it starts.
 */
public record TermMatch(String text, int position) {}
