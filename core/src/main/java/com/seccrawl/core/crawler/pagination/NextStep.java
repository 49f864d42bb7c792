package com.seccrawl.core.crawler.pagination;

import java.util.Objects;

/** 페이지네이션 한 단계의 결정: 다음 URL 로 이동 또는 중단. */
public interface NextStep {

    record Follow(String url) implements NextStep {
        public Follow {
            Objects.requireNonNull(url, "url");
        }
    }

    record Stop(String reason) implements NextStep {}

    static NextStep follow(String url) { return new Follow(url); }
    static NextStep stop(String reason) { return new Stop(reason); }
}
