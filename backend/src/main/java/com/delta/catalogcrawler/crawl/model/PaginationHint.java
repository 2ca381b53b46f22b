package com.delta.catalogcrawler.crawl.model;

public record PaginationHint(
    String nextUrl,
    boolean loadMore,
    Integer currentPage,
    Integer totalPages
) {
    public static PaginationHint none() {
        return new PaginationHint(null, false, null, null);
    }

    public boolean hasNext() {
        return nextUrl != null && !nextUrl.isBlank();
    }
}
