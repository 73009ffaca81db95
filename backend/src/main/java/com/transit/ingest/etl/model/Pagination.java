package com.transit.ingest.etl.model;

/**
 * How the extractor walks a paginated endpoint.
 *
 * <p>OFFSET sends {@code pageParam=<record offset>} and PAGE sends {@code pageParam=<page number>},
 * both with {@code sizeParam=pageSize}. CURSOR sends {@code cursorParam} with the value read from
 * {@code cursorField} of the previous response.
 */
public record Pagination(
    PaginationMode mode,
    String pageParam,
    String sizeParam,
    int pageSize,
    int startPage,
    String cursorParam,
    String cursorField,
    int maxPages
) {
    public Pagination {
        mode = mode == null ? PaginationMode.NONE : mode;
        pageSize = Math.max(1, pageSize);
        startPage = Math.max(0, startPage);
        maxPages = Math.max(1, maxPages);
    }

    public static Pagination none() {
        return new Pagination(PaginationMode.NONE, null, null, 1, 0, null, null, 1);
    }

    public static Pagination offset(String offsetParam, String limitParam, int pageSize, int maxPages) {
        return new Pagination(PaginationMode.OFFSET, offsetParam, limitParam, pageSize, 0, null, null, maxPages);
    }

    public static Pagination page(String pageParam, String sizeParam, int pageSize, int startPage, int maxPages) {
        return new Pagination(PaginationMode.PAGE, pageParam, sizeParam, pageSize, startPage, null, null, maxPages);
    }

    public static Pagination cursor(String cursorParam, String cursorField, int maxPages) {
        return new Pagination(PaginationMode.CURSOR, null, null, 1, 0, cursorParam, cursorField, maxPages);
    }
}
