package com.deskhub.inbox.common.api;

/**
 * 1-based page window. {@code page} defaults to 1 and {@code perPage} to 20, capped at 200.
 * A page whose first row would lie past {@link Integer#MAX_VALUE} is rejected as {@code invalid_parameter}.
 */
public record Pagination(int page, int perPage) {

    public static final int DEFAULT_PER_PAGE = 20;
    public static final int MAX_PER_PAGE = 200;

    public Pagination {
        if (page < 1 || perPage < 1 || (long) (page - 1) * perPage > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("invalid_parameter");
        }
    }

    public static Pagination of(Integer page, Integer perPage) {
        int p = page == null || page < 1 ? 1 : page;
        int pp = perPage == null || perPage < 1 ? DEFAULT_PER_PAGE : Math.min(perPage, MAX_PER_PAGE);
        return new Pagination(p, pp);
    }

    public int skip() {
        return (page - 1) * perPage;
    }
}
