package com.seccrawl.core.crawler.pagination;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.parse.MarkupExtractor;

import java.util.Objects;
import java.util.Optional;

/** "다음" 컨트롤(셀렉터 첫 매칭 요소의 href)을 따라간다. 없으면 중단. */
public final class SelectorPagination implements PaginationStrategy {

    private final String nextSelector;
    private final MarkupExtractor extractor;

    /** @throws ConfigurationException 비었거나 문법이 틀린 셀렉터 */
    public SelectorPagination(String nextSelector, MarkupExtractor extractor) {
        if (nextSelector == null || nextSelector.isBlank()) {
            throw new ConfigurationException("nextSelector must not be blank");
        }
        this.nextSelector = nextSelector;
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        // 문법 오류는 첫 요청 전에 드러나야 한다
        extractor.firstLink("", "", nextSelector, "href");
    }

    @Override
    public NextStep next(Page current, String currentUrl) {
        String html = current.getHtml();
        if (html == null) return NextStep.stop("page markup not retained");
        String base = (current.sourceUrl() != null) ? current.sourceUrl() : currentUrl;
        Optional<String> href = extractor.firstLink(html, base, nextSelector, "href");
        return href.map(NextStep::follow)
                .orElseGet(() -> NextStep.stop("no next link for " + nextSelector));
    }

    public String nextSelector() { return nextSelector; }
}
