package com.studyapp.data.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestionType {
    MULTIPLE_CHOICE("multiple_choice"),
    MULTIPLE_SELECT("multiple_select"),
    TRUE_FALSE("true_false"),
    FILL_IN_THE_BLANK("fill_in_the_blank"),
    DRAG_AND_DROP("drag_and_drop"),
    SCENARIO("scenario"),
    SIMULATION("simulation");
    
    private final String value;
    
    QuestionType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static QuestionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (QuestionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown question type: " + value);
    }
}
