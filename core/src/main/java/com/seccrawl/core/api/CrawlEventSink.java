package com.seccrawl.core.api;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;

/**
 * 크롤 관측 이벤트 수신자. 각 컴포넌트에 생성자로 주입한다(전역 로거 설정에 의존하지 않음).
 * 모든 메서드는 기본 no-op 이라 필요한 이벤트만 구현하면 된다.
 * 멀티 워커 모드에서는 여러 스레드에서 동시에 호출될 수 있다.
 */
public interface CrawlEventSink {

    /** 요청 시도 직전. proxy는 직접 연결이면 null */
    default void onAttempt(URI url, int attempt, InetSocketAddress proxy) {}

    /** 실패 후 backoff 대기 직전 */
    default void onRetry(URI url, int attempt, Duration backoff, Exception cause) {}

    /** 재시도 소진 */
    default void onExhausted(URI url, int attempts, String lastError) {}

    /** 스코프 밖 URL을 버림(실패 아님) */
    default void onScopeRejected(String url, String reason) {}

    /** 페이지 수집 성공. collected는 누적 수 */
    default void onPageCollected(String url, int collected) {}

    /** 전송/파싱 실패로 URL 하나를 누락 처리 */
    default void onPageFailed(String url, String cause, String detail) {}

    /** 크롤 실행 종료 */
    default void onFinished(String reason, int collected) {}

    CrawlEventSink NONE = new CrawlEventSink() {};
}
