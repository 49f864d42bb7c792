package com.seccrawl.core.http;

import com.seccrawl.core.model.FetchRequest;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** 요청 1회 송신 훅. 재시도/헤더 선택은 RequestExecutor 책임. 테스트에서 가짜 구현을 주입한다. */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @param headers 이번 시도에 보낼 헤더(식별 헤더 + 오버라이드)
     * @param proxy   null이면 직접 연결
     * @throws IOException 연결 오류/타임아웃
     */
    TransportResponse send(FetchRequest request, Map<String, String> headers,
                           InetSocketAddress proxy, Duration timeout) throws IOException, InterruptedException;

    /** 상태코드와 무관하게 응답이 도착한 경우의 원본 */
    record TransportResponse(int status, Map<String, List<String>> headers, String body, URI uri) {}
}
