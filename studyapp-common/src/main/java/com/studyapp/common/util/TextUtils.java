package com.studyapp.common.util;

import java.util.Locale;

public final class TextUtils {
    
    private TextUtils() {}
    
    public static String lowerOrEmpty(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT);
    }
    
    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
    
    /**
     * Shortens user text for log lines.
     */
    public static String preview(String text, int maxChars) {
        if (text == null) {
            return "null";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "...";
    }
}
