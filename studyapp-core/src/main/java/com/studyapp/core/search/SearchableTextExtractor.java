package com.studyapp.core.search;

import com.studyapp.common.util.TextUtils;
import com.studyapp.core.search.model.SearchableText;
import com.studyapp.data.model.QuestionRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Component
public class SearchableTextExtractor {
    
    public SearchableText extract(QuestionRecord question) {
        return new SearchableText(
            TextUtils.lowerOrEmpty(question.getQuestionText()),
            lowerAll(question.getOptions()),
            TextUtils.lowerOrEmpty(question.getExplanation()),
            lowerAll(question.getTags())
        );
    }
    
    private List<String> lowerAll(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .map(TextUtils::lowerOrEmpty)
            .collect(Collectors.toUnmodifiableList());
    }
}
