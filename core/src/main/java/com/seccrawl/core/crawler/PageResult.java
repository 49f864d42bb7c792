package com.seccrawl.core.crawler;

import com.seccrawl.core.model.Page;

import java.util.Objects;

/** PageFetcher 결과: Fetched 또는 Failed. */
public interface PageResult {

    /** 실패 원인: 전송(재시도 소진 포함) / 파싱 */
    enum Cause { TRANSPORT, PARSE }

    int attempts();

    record Fetched(Page page, int attempts) implements PageResult {
        public Fetched {
            Objects.requireNonNull(page, "page");
        }
    }

    record Failed(String url, Cause cause, int attempts, String detail) implements PageResult {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
