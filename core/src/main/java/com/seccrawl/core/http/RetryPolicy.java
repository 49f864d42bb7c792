package com.seccrawl.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(현재 시도 번호). statusCode -1은 네트워크 오류. true면 지연 후 재시도. */
    boolean shouldRetry(int statusCode, int attempt);
    /** attempt 번째 실패 후 다음 시도 전 지연. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: 3이면 최대 3번 시도. */
    int maxAttempts();

    /** 2xx/3xx만 성공으로 본다. */
    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 400;
    }
}
