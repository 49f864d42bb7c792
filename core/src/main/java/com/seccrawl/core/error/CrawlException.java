package com.seccrawl.core.error;

/** 크롤 엔진 도메인 예외의 공통 상위 타입. */
public class CrawlException extends RuntimeException {
    public CrawlException(String message) { super(message); }
    public CrawlException(String message, Throwable cause) { super(message, cause); }
}
