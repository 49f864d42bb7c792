package com.seccrawl.core.model;

/** ResultSink가 직렬화하는 레코드: 사이트 크롤의 Page 또는 페이지네이션 크롤의 ExtractionRecord. */
public interface CrawlRecord {
    String sourceUrl();
}
