package com.seccrawl.core.crawler.pagination;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.parse.MarkupExtractor;

/**
 * "다음 페이지" 계산 전략.
 * 실행마다 새로 만든다. ParameterPagination 은 호출마다 페이지 번호를 올리는 상태를 가진다.
 */
public interface PaginationStrategy {

    /**
     * @param current    방금 가져온 페이지
     * @param currentUrl 이 페이지를 요청한 URL
     */
    NextStep next(Page current, String currentUrl);

    /**
     * 설정에서 전략을 고른다. nextSelector 와 pageParam 은 동시에 쓸 수 없다.
     * @throws ConfigurationException 둘 다 설정했거나 시작 URL 의 페이지 값이 정수가 아닐 때
     */
    static PaginationStrategy from(CrawlConfig config, MarkupExtractor extractor) {
        String sel = config.getNextSelector();
        String param = config.getPageParam();
        boolean hasSel = sel != null && !sel.isBlank();
        boolean hasParam = param != null && !param.isBlank();
        if (hasSel && hasParam) {
            throw new ConfigurationException("nextSelector and pageParam are mutually exclusive");
        }
        if (hasSel) return new SelectorPagination(sel, extractor);
        if (hasParam) return new ParameterPagination(param, config.getStartUrl());
        return NoPagination.INSTANCE;
    }
}
