package com.seccrawl.core.api;

import com.seccrawl.core.crawler.PageResult;

/** URL 하나를 가져와 Page로 만드는 최소 계약. 실패는 예외 대신 PageResult.Failed 로 돌려준다. */
@FunctionalInterface
public interface IPageFetcher {
    PageResult fetch(String url);
}
