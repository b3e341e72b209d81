package com.studyapp.core.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PageSlice<T> {
    List<T> items;
    int total;
    int limit;
    int offset;
    boolean hasMore;
}
