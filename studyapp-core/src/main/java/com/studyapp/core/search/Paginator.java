package com.studyapp.core.search;

import com.studyapp.core.search.model.PageSlice;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class Paginator {
    
    /**
     * Slice {@code [offset, offset + limit)} out of the full result list.
     */
    public <T> PageSlice<T> paginate(List<T> results, int offset, int limit) {
        int total = results.size();
        List<T> items;
        if (offset >= total || limit <= 0) {
            items = List.of();
        } else {
            int end = (int) Math.min((long) offset + limit, total);
            items = List.copyOf(results.subList(offset, end));
        }
        return PageSlice.<T>builder()
            .items(items)
            .total(total)
            .limit(limit)
            .offset(offset)
            .hasMore((long) offset + limit < total)
            .build();
    }
}
