package com.seccrawl.app;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlAppTest {

    private HttpServer server;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            byte[] body = "<html><head><title>t</title></head><body><p class='x'>hi</p></body></html>"
                    .getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, body.length);
            ex.getResponseBody().write(body);
            ex.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private String url() { return "http://127.0.0.1:" + server.getAddress().getPort() + "/"; }

    private int run(String... args) {
        return CrawlApp.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void help_prints_usage() {
        assertThat(run("--help")).isEqualTo(CrawlApp.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Usage: seccrawl");
    }

    @Test
    void configuration_errors_exit_2() {
        assertThat(run("--bogus")).isEqualTo(CrawlApp.EXIT_CONFIG);
        assertThat(run(url(), "--format", "xml")).isEqualTo(CrawlApp.EXIT_CONFIG);
        assertThat(run("--max-pages", "3")).isEqualTo(CrawlApp.EXIT_CONFIG); // 시작 URL 없음
        assertThat(run(url(), "--selector", ".x", "--next-selector", "a", "--page-param", "p"))
                .isEqualTo(CrawlApp.EXIT_CONFIG);
        assertThat(run("--config", "does-not-exist.yml")).isEqualTo(CrawlApp.EXIT_CONFIG);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Configuration error");
    }

    @Test
    void crawl_writes_result_file(@TempDir Path dir) throws Exception {
        int code = run(url(), "--delay", "0", "--max-retries", "1", "--output-dir", dir.toString());

        assertThat(code).isEqualTo(CrawlApp.EXIT_OK);
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .singleElement().asString().startsWith("crawl_results_").endsWith(".json");
        }
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Collected 1 record(s)");
    }

    @Test
    void yaml_config_with_flag_override(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("crawl.yml");
        Files.writeString(yml, String.join("\n",
                "startUrl: \"" + url() + "\"",
                "delay: 0",
                "maxRetries: 1",
                "pagination:",
                "  dataSelector: \".x\"",
                "output:",
                "  format: json"));
        Path outDir = dir.resolve("out");

        int code = run("--config", yml.toString(), "--format", "csv", "--output-dir", outDir.toString());

        assertThat(code).isEqualTo(CrawlApp.EXIT_OK);
        try (Stream<Path> files = Files.list(outDir)) {
            Path csv = files.findFirst().orElseThrow();
            assertThat(csv.toString()).endsWith(".csv");
            assertThat(Files.readAllLines(csv)).first().isEqualTo("URL,Index,Text Content,HTML Content,class");
        }
    }

    @Test
    void unwritable_output_exits_1(@TempDir Path dir) throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");

        int code = run(url(), "--delay", "0", "--max-retries", "1", "--output-dir", blocker.toString());

        assertThat(code).isEqualTo(CrawlApp.EXIT_IO);
    }
}
