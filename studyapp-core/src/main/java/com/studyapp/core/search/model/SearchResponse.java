package com.studyapp.core.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchResponse {
    List<ScoredResult> items;
    int total;
    String query;
    long searchTimeMs;
    FilterOptions filters;
    Pagination pagination;
    
    @Value
    @Builder
    public static class Pagination {
        int limit;
        int offset;
        boolean hasMore;
    }
}
