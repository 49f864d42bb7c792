package com.seccrawl.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlParamUtilTest {

    @Test
    void parse_keeps_order_and_last_value_wins() {
        var q = UrlParamUtil.parseQuery(URI.create("https://ex.com/p?a=1&b=x%20y&a=3&flag"));
        assertThat(q).containsExactly(Map.entry("a", "3"), Map.entry("b", "x y"), Map.entry("flag", ""));
    }

    @Test
    void with_param_replaces_in_place() {
        URI u = UrlParamUtil.withParam(URI.create("https://ex.com/list?cat=7&page=1&sort=asc"), "page", "2");
        assertThat(u.toString()).isEqualTo("https://ex.com/list?cat=7&page=2&sort=asc");
    }

    @Test
    void with_param_appends_new_key_at_end() {
        URI u = UrlParamUtil.withParam(URI.create("https://ex.com/list?cat=7"), "page", "2");
        assertThat(u.toString()).isEqualTo("https://ex.com/list?cat=7&page=2");
        assertThat(UrlParamUtil.withParam(URI.create("https://ex.com"), "page", "2").toString())
                .isEqualTo("https://ex.com/?page=2");
    }

    @Test
    void encoded_path_and_fragment_are_not_double_encoded() {
        URI u = UrlParamUtil.withParam(URI.create("https://ex.com/a%20b?x=1#sec"), "y", "2");
        assertThat(u.toString()).isEqualTo("https://ex.com/a%20b?x=1&y=2#sec");
    }

    @Test
    void build_query_encodes_values() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("q", "a&b");
        m.put("k", "한");
        assertThat(UrlParamUtil.buildQuery(m)).isEqualTo("q=a%26b&k=%ED%95%9C");
    }
}
