package com.seccrawl.core.model;

/** FetchOutcome.Failure 분류. */
public enum FailureKind {
    /** maxRetries 회 모두 실패 */
    EXHAUSTED,
    /** 재시도 도중 인터럽트(취소) */
    INTERRUPTED
}
