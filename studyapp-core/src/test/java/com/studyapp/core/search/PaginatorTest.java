package com.studyapp.core.search;

import com.studyapp.core.search.model.PageSlice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PaginatorTest {

    private final Paginator paginator = new Paginator();

    private List<Integer> numbers(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    @Test
    @DisplayName("limit 10, offset 25 over 27 results gives the last 2")
    void lastPartialPage() {
        PageSlice<Integer> page = paginator.paginate(numbers(27), 25, 10);

        assertEquals(List.of(25, 26), page.getItems());
        assertEquals(27, page.getTotal());
        assertFalse(page.isHasMore());
    }

    @Test
    void firstPage_hasMore() {
        PageSlice<Integer> page = paginator.paginate(numbers(27), 0, 10);

        assertEquals(numbers(10), page.getItems());
        assertTrue(page.isHasMore());
    }

    @Test
    void exactFit_hasNoMore() {
        PageSlice<Integer> page = paginator.paginate(numbers(20), 10, 10);

        assertEquals(10, page.getItems().size());
        assertFalse(page.isHasMore());
    }

    @Test
    void offsetBeyondTotal_isEmpty() {
        PageSlice<Integer> page = paginator.paginate(numbers(5), 50, 10);

        assertTrue(page.getItems().isEmpty());
        assertEquals(5, page.getTotal());
        assertFalse(page.isHasMore());
    }

    @Test
    @DisplayName("item count and hasMore follow min(limit, total - offset) and offset + limit < total")
    void sizeAndHasMore_acrossShapes() {
        for (int total = 0; total <= 12; total++) {
            for (int limit = 1; limit <= 5; limit++) {
                for (int offset = 0; offset <= 14; offset++) {
                    PageSlice<Integer> page = paginator.paginate(numbers(total), offset, limit);
                    assertEquals(Math.max(0, Math.min(limit, total - offset)), page.getItems().size());
                    assertEquals(offset + limit < total, page.isHasMore());
                }
            }
        }
    }
}
