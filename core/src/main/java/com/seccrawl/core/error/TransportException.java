package com.seccrawl.core.error;

/** 연결 오류/타임아웃/비성공 상태코드. RequestExecutor 내부에서만 재시도 대상으로 쓰인다. */
public class TransportException extends CrawlException {
    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(int statusCode) {
        super("HTTP status " + statusCode);
        this.statusCode = statusCode;
    }

    /** 상태코드 기반 실패면 해당 코드, 네트워크 오류면 -1. */
    public int getStatusCode() { return statusCode; }
}
