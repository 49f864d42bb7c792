package com.seccrawl.core.testing;

import com.seccrawl.core.http.HttpTransport;
import com.seccrawl.core.model.FetchRequest;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** 미리 정한 응답/예외를 순서대로 돌려주는 전송 훅. 마지막 항목은 계속 반복. */
public final class FakeTransport implements HttpTransport {

    /** 한 번의 send 호출 기록 */
    public record Call(FetchRequest request, Map<String, String> headers, InetSocketAddress proxy) {}

    private final List<Object> script;
    public final List<Call> calls = new ArrayList<>();

    private FakeTransport(List<Object> script) { this.script = script; }

    /** 항목: Integer(상태코드, 본문은 "ok") 또는 IOException */
    public static FakeTransport of(Object... steps) { return new FakeTransport(List.of(steps)); }

    public static FakeTransport alwaysStatus(int status) { return of(status); }

    @Override
    public synchronized TransportResponse send(FetchRequest request, Map<String, String> headers,
                                               InetSocketAddress proxy, Duration timeout) throws IOException {
        calls.add(new Call(request, Map.copyOf(headers), proxy));
        Object step = script.get(Math.min(calls.size() - 1, script.size() - 1));
        if (step instanceof IOException e) throw e;
        int status = (Integer) step;
        return new TransportResponse(status, Map.of("Content-Type", List.of("text/html")), "ok", request.getUrl());
    }
}
