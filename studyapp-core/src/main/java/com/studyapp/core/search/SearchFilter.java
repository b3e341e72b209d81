package com.studyapp.core.search;

import com.studyapp.core.search.model.FilterOptions;
import com.studyapp.core.search.model.SearchQuery;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.model.QuestionType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Non-text filters (provider, exam, topic, difficulty, type, tags) and the facet values they leave.
 * Tags and difficulty compare case-insensitively.
 */
@Component
public class SearchFilter {
    
    public List<QuestionRecord> apply(List<QuestionRecord> questions, SearchQuery query) {
        return questions.stream()
            .filter(Objects::nonNull)
            // The slice already narrows by provider/exam except when exam is given alone
            .filter(q -> query.getProvider() == null || query.getProvider().equals(q.getProviderId()))
            .filter(q -> query.getExam() == null || query.getExam().equals(q.getExamId()))
            .filter(q -> query.getTopic() == null || query.getTopic().equals(q.getTopicId()))
            .filter(q -> query.getDifficulty() == null || query.getDifficulty().equalsIgnoreCase(q.getDifficulty()))
            .filter(q -> query.getType() == null || query.getType() == q.effectiveType())
            .filter(q -> !query.hasTagFilter() || hasAnyTag(q, query.getTags()))
            .collect(Collectors.toList());
    }
    
    /**
     * Distinct values present in the questions. Providers, exams, topics and tags are
     * sorted; difficulties and types keep first-seen order.
     */
    public FilterOptions collectOptions(List<QuestionRecord> questions) {
        if (questions.isEmpty()) {
            return FilterOptions.empty();
        }
        Set<String> providers = new TreeSet<>();
        Set<String> exams = new TreeSet<>();
        Set<String> topics = new TreeSet<>();
        Set<String> difficulties = new LinkedHashSet<>();
        Set<QuestionType> types = new LinkedHashSet<>();
        Set<String> tags = new TreeSet<>();
        
        for (QuestionRecord question : questions) {
            addIfPresent(providers, question.getProviderId());
            addIfPresent(exams, question.getExamId());
            addIfPresent(topics, question.getTopicId());
            addIfPresent(difficulties, question.getDifficulty());
            types.add(question.effectiveType());
            if (question.getTags() != null) {
                question.getTags().forEach(tag -> addIfPresent(tags, tag));
            }
        }
        
        return FilterOptions.builder()
            .providers(List.copyOf(providers))
            .exams(List.copyOf(exams))
            .topics(List.copyOf(topics))
            .difficulties(List.copyOf(difficulties))
            .types(List.copyOf(types))
            .tags(List.copyOf(tags))
            .build();
    }
    
    private boolean hasAnyTag(QuestionRecord question, List<String> wanted) {
        if (question.getTags() == null) {
            return false;
        }
        return wanted.stream().anyMatch(tag -> question.getTags().stream()
            .anyMatch(candidate -> candidate != null && candidate.equalsIgnoreCase(tag)));
    }
    
    private void addIfPresent(Set<String> values, String value) {
        if (value != null && !value.isBlank()) {
            values.add(value);
        }
    }
}
