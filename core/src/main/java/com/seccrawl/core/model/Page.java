package com.seccrawl.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 파싱된 페이지(불변).
 * - links/images: 절대 URL, 문서 순서, 중복 허용
 * - meta: name→content, 같은 name이면 마지막 값
 * - html: 셀렉터 기반 페이지네이션용 원본 마크업(직렬화 제외)
 */
@JsonPropertyOrder({"url", "title", "text", "links", "images", "meta", "status_code", "headers"})
public final class Page implements CrawlRecord {
    private final String url;
    private final String title;
    private final String text;
    private final List<String> links;
    private final List<String> images;
    private final Map<String, String> meta;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String html;

    private Page(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.title = b.title;
        this.text = (b.text == null) ? "" : b.text;
        this.links = List.copyOf(b.links);
        this.images = List.copyOf(b.images);
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(b.meta));
        this.statusCode = b.statusCode;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.html = (b.html == null) ? "" : b.html;
    }

    public static Builder builder(String url) { return new Builder(url); }

    @Override
    @JsonProperty("url")
    public String sourceUrl() { return url; }

    /** 제목이 없으면 null (JSON에는 null로 기록) */
    @JsonProperty("title")
    public String getTitle() { return title; }

    public Optional<String> title() { return Optional.ofNullable(title); }

    @JsonProperty("text")
    public String getText() { return text; }

    @JsonProperty("links")
    public List<String> getLinks() { return links; }

    @JsonProperty("images")
    public List<String> getImages() { return images; }

    @JsonProperty("meta")
    public Map<String, String> getMeta() { return meta; }

    @JsonProperty("status_code")
    public int getStatusCode() { return statusCode; }

    @JsonProperty("headers")
    public Map<String, List<String>> getHeaders() { return headers; }

    @JsonIgnore
    public String getHtml() { return html; }

    @Override public String toString() { return "Page[" + url + ", status=" + statusCode + ", links=" + links.size() + "]"; }

    public static final class Builder {
        private final String url;
        private String title;
        private String text;
        private final List<String> links = new ArrayList<>();
        private final List<String> images = new ArrayList<>();
        private final Map<String, String> meta = new LinkedHashMap<>();
        private int statusCode;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private String html;

        private Builder(String url) { this.url = url; }

        public Builder title(String v) { this.title = v; return this; }
        public Builder text(String v) { this.text = v; return this; }
        public Builder link(String v) { if (v != null) links.add(v); return this; }
        public Builder links(List<String> vs) { if (vs != null) vs.forEach(this::link); return this; }
        public Builder image(String v) { if (v != null) images.add(v); return this; }
        public Builder meta(String name, String content) {
            // 같은 name이면 마지막 값이 이긴다
            meta.put(name == null ? "" : name, content == null ? "" : content);
            return this;
        }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder headers(Map<String, List<String>> hs) {
            if (hs != null) hs.forEach((k, v) -> headers.put(k, v == null ? List.of() : List.copyOf(v)));
            return this;
        }
        public Builder html(String v) { this.html = v; return this; }
        public Page build() { return new Page(this); }
    }
}
