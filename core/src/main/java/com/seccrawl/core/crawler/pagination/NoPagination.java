package com.seccrawl.core.crawler.pagination;

import com.seccrawl.core.model.Page;

/** 페이지네이션 미설정: 첫 페이지만. */
public final class NoPagination implements PaginationStrategy {

    public static final NoPagination INSTANCE = new NoPagination();

    private NoPagination() {}

    @Override
    public NextStep next(Page current, String currentUrl) {
        return NextStep.stop("no pagination configured");
    }
}
