package com.social.connection.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    private static final List<Integer> ITEMS = IntStream.range(0, 25).boxed().toList();

    @Nested
    @DisplayName("PageRequest")
    class PageRequestTests {

        @Test
        @DisplayName("of(page, size) computes the offset")
        void ofComputesOffset() {
            PageRequest request = PageRequest.of(2, 10);

            assertEquals(20, request.offset());
            assertEquals(10, request.limit());
            assertEquals(2, request.pageNumber());
        }

        @Test
        @DisplayName("Rejects negative offsets and out-of-range limits")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(-1, 10));
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 0));
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 1001));
            assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        }
    }

    @Nested
    @DisplayName("Page")
    class PageTests {

        @Test
        @DisplayName("First page of many")
        void firstPage() {
            Page<Integer> page = Page.of(ITEMS, PageRequest.first(10));

            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), page.content());
            assertEquals(25, page.totalElements());
            assertEquals(3, page.totalPages());
            assertTrue(page.hasNext());
            assertFalse(page.hasPrevious());
        }

        @Test
        @DisplayName("Last page is partial")
        void lastPage() {
            Page<Integer> page = Page.of(ITEMS, PageRequest.of(2, 10));

            assertEquals(5, page.numberOfElements());
            assertFalse(page.hasNext());
            assertTrue(page.hasPrevious());
        }

        @Test
        @DisplayName("Page past the end is empty but keeps the total")
        void pastEnd() {
            Page<Integer> page = Page.of(ITEMS, PageRequest.of(5, 10));

            assertTrue(page.content().isEmpty());
            assertEquals(25, page.totalElements());
        }

        @Test
        @DisplayName("Content is an immutable copy")
        void immutable() {
            Page<Integer> page = Page.of(ITEMS, PageRequest.first(5));

            assertThrows(UnsupportedOperationException.class, () -> page.content().add(99));
        }
    }
}
