package com.seccrawl.core.testing;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 경로별 HTML 을 돌려주는 로컬 HTTP 서버. 등록 안 된 경로는 404. */
public final class TestServer implements AutoCloseable {

    private final HttpServer server;
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final Map<String, String> redirects = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    private TestServer(HttpServer server) { this.server = server; }

    public static TestServer start() throws IOException {
        HttpServer s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        TestServer ts = new TestServer(s);
        s.createContext("/", ts::handle);
        s.start();
        return ts;
    }

    public TestServer page(String path, String html) { pages.put(path, html); return this; }

    public TestServer redirect(String from, String to) { redirects.put(from, to); return this; }

    public String url(String pathAndQuery) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + pathAndQuery;
    }

    public int hits(String path) {
        AtomicInteger n = hits.get(path);
        return (n == null) ? 0 : n.get();
    }

    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
        String location = redirects.get(path);
        if (location != null) {
            ex.getResponseHeaders().add("Location", location);
            ex.sendResponseHeaders(302, -1);
            ex.close();
            return;
        }
        String html = pages.get(path);
        byte[] body = (html == null ? "not found" : html).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(html == null ? 404 : 200, body.length);
        ex.getResponseBody().write(body);
        ex.close();
    }

    @Override public void close() { server.stop(0); }
}
