package com.social.connection.api;

import java.util.List;

/**
 * A page of results.
 *
 * @param content       the content of this page
 * @param totalElements total number of elements across all pages
 * @param pageNumber    the current page number (0-based)
 * @param pageSize      the requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts one page out of a fully materialised, already ordered list.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int from = Math.min(request.offset(), all.size());
        int to = Math.min(from + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public boolean hasPrevious() {
        return pageNumber > 0;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    public int numberOfElements() {
        return content.size();
    }
}
