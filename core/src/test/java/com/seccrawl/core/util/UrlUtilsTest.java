package com.seccrawl.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    void resolve_follows_standard_join() {
        assertThat(UrlUtils.resolve("https://example.com/a/b.html", "c.html")).isEqualTo("https://example.com/a/c.html");
        assertThat(UrlUtils.resolve("https://example.com/a/b.html", "../x")).isEqualTo("https://example.com/x");
        assertThat(UrlUtils.resolve("https://example.com/a/", "/root")).isEqualTo("https://example.com/root");
        assertThat(UrlUtils.resolve("https://example.com/a", "?q=1")).isEqualTo("https://example.com/a?q=1");
        assertThat(UrlUtils.resolve("https://example.com/a", "//cdn.net/p")).isEqualTo("https://cdn.net/p");
        assertThat(UrlUtils.resolve("https://example.com/a", "")).isEqualTo("https://example.com/a");
    }

    @Test
    void resolve_returns_null_for_unknown_protocol() {
        assertThat(UrlUtils.resolve("https://example.com/", "foo:bar")).isNull();
    }

    @Test
    void canonical_lowercases_scheme_host_and_drops_default_port() {
        assertThat(UrlUtils.canonical("HTTPS://Example.COM:443")).isEqualTo("https://example.com/");
        assertThat(UrlUtils.canonical("http://example.com:8080/P?Q=1#F")).isEqualTo("http://example.com:8080/P?Q=1#F");
        assertThat(UrlUtils.canonical("http://example.com:80/x")).isEqualTo("http://example.com/x");
    }

    @Test
    void host_is_lowercased_or_null() {
        assertThat(UrlUtils.host("https://WWW.Example.com/x")).isEqualTo("www.example.com");
        assertThat(UrlUtils.host("not a url")).isNull();
        assertThat(UrlUtils.host("/relative")).isNull();
    }
}
