package com.seccrawl.core.error;

/** 응답 본문에서 페이지 정보를 추출하지 못함. URL 단위로 보고되고 재시도하지 않는다. */
public class MarkupParseException extends CrawlException {
    public MarkupParseException(String message, Throwable cause) { super(message, cause); }
}
