package com.seccrawl.core.http;

import com.sun.net.httpserver.HttpServer;
import com.seccrawl.core.model.FetchRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JdkHttpTransportTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", ex -> {
            lastQuery.set(ex.getRequestURI().getRawQuery());
            lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAgent.set(ex.getRequestHeaders().getFirst("User-Agent"));
            byte[] b = "<html>echo</html>".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, b.length);
            ex.getResponseBody().write(b);
            ex.close();
        });
        server.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/echo");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() { server.stop(0); }

    private URI url(String p) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + p);
    }

    private static Map<String, String> headers() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", "test-agent");
        h.put("Connection", "keep-alive"); // HttpClient 제한 헤더: 건너뜀
        return h;
    }

    @Test
    void query_params_are_appended_to_existing_query() throws Exception {
        var t = new JdkHttpTransport(Duration.ofSeconds(2), true);
        var req = FetchRequest.builder(url("/echo?a=1")).param("b", "x y").build();

        var resp = t.send(req, headers(), null, Duration.ofSeconds(2));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.body()).isEqualTo("<html>echo</html>");
        assertThat(lastQuery.get()).isEqualTo("a=1&b=x+y");
        assertThat(lastAgent.get()).isEqualTo("test-agent");
    }

    @Test
    void form_fields_are_sent_urlencoded() throws Exception {
        var t = new JdkHttpTransport(Duration.ofSeconds(2), true);
        var req = FetchRequest.builder(url("/echo")).method("POST").formField("q", "한글").formField("n", "1").build();

        t.send(req, headers(), null, Duration.ofSeconds(2));

        assertThat(lastBody.get()).isEqualTo("q=%ED%95%9C%EA%B8%80&n=1");
    }

    @Test
    void redirects_are_followed_and_final_uri_reported() throws Exception {
        var t = new JdkHttpTransport(Duration.ofSeconds(2), true);
        var resp = t.send(FetchRequest.get(url("/moved")), headers(), null, Duration.ofSeconds(2));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.uri().getPath()).isEqualTo("/echo");
    }

    @Test
    void redirects_can_be_disabled() throws Exception {
        var t = new JdkHttpTransport(Duration.ofSeconds(2), false);
        var resp = t.send(FetchRequest.get(url("/moved")), headers(), null, Duration.ofSeconds(2));

        assertThat(resp.status()).isEqualTo(302);
    }
}
