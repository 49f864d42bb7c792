package com.seccrawl.core.crawler;

import com.seccrawl.core.api.IPageFetcher;
import com.seccrawl.core.error.MarkupParseException;
import com.seccrawl.core.http.RequestExecutor;
import com.seccrawl.core.model.FetchOutcome;
import com.seccrawl.core.model.ExtractedElement;
import com.seccrawl.core.model.FetchRequest;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.parse.MarkupExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * RequestExecutor + MarkupExtractor.
 * 전송 실패(재시도 소진)와 파싱 실패를 구분해서 돌려준다. 파싱 실패는 재시도하지 않는다.
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    private final RequestExecutor executor;
    private final MarkupExtractor extractor;

    public PageFetcher(RequestExecutor executor, MarkupExtractor extractor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public PageResult fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return new PageResult.Failed(url, PageResult.Cause.TRANSPORT, 0, "invalid url: " + e.getMessage());
        }

        FetchOutcome outcome = executor.execute(FetchRequest.get(uri));
        if (outcome instanceof FetchOutcome.Failure f) {
            return new PageResult.Failed(url, PageResult.Cause.TRANSPORT, f.attempts(),
                    f.kind() + ": " + f.lastError());
        }

        FetchOutcome.Success ok = (FetchOutcome.Success) outcome;
        try {
            return new PageResult.Fetched(extractor.parsePage(ok), ok.attempts());
        } catch (MarkupParseException e) {
            LOG.error("Error parsing page {}: {}", url, e.getMessage());
            return new PageResult.Failed(url, PageResult.Cause.PARSE, ok.attempts(), e.getMessage());
        }
    }

    /**
     * 가져온 페이지에서 selector 매칭 요소를 뽑는다. 링크는 페이지 주소 기준으로 해석한다.
     * @throws com.seccrawl.core.error.ConfigurationException selector 문법 오류
     */
    public List<ExtractedElement> select(Page page, String selector) {
        Objects.requireNonNull(page, "page");
        return extractor.select(page.getHtml(), page.sourceUrl(), selector);
    }

    public MarkupExtractor extractor() { return extractor; }
}
