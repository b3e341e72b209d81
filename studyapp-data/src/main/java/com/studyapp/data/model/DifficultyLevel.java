package com.studyapp.data.model;

import java.util.Locale;

/**
 * Difficulty labels found in question files. Both the easy/medium/hard and the
 * beginner..expert vocabularies are in use, so each label carries a rank.
 */
public enum DifficultyLevel {
    EASY("easy", 0),
    BEGINNER("beginner", 0),
    MEDIUM("medium", 1),
    INTERMEDIATE("intermediate", 1),
    HARD("hard", 2),
    ADVANCED("advanced", 2),
    EXPERT("expert", 3);
    
    public static final int DEFAULT_RANK = 1;
    
    private final String label;
    private final int rank;
    
    DifficultyLevel(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }
    
    public String getLabel() {
        return label;
    }
    
    public int getRank() {
        return rank;
    }
    
    /**
     * Rank of a raw difficulty label; unknown or missing labels rank in the middle.
     */
    public static int rankOf(String label) {
        if (label == null) {
            return DEFAULT_RANK;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (DifficultyLevel level : values()) {
            if (level.label.equals(normalized)) {
                return level.rank;
            }
        }
        return DEFAULT_RANK;
    }
}
