package com.studyapp.common.constants;

public final class SearchLimits {
    public static final int MAX_QUERY_LENGTH = 500;
    
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;
    public static final int DEFAULT_LIMIT = 20;
    public static final int DEFAULT_OFFSET = 0;
    
    public static final int MAX_TERMS = 15;
    public static final int MIN_TERM_LENGTH = 2;
    public static final int HIGHLIGHT_CAP = 10;
    
    public static final long DEFAULT_CACHE_TTL_MINUTES = 15;
    
    private SearchLimits() {}
    
    public static boolean isValidLimit(int limit) {
        return limit >= MIN_LIMIT && limit <= MAX_LIMIT;
    }
    
    public static boolean isValidOffset(int offset) {
        return offset >= 0;
    }
}
