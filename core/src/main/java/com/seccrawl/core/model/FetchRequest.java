package com.seccrawl.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 HTTP 요청 명세. 시도(attempt)마다 동일한 인스턴스를 재사용하므로 불변이다.
 * - queryParams: 입력 순서 유지, 키 중복 시 마지막 값
 * - formFields: 비어있지 않으면 application/x-www-form-urlencoded 본문
 * - headerOverrides: 랜덤 식별 헤더 위에 덮어쓴다
 */
public final class FetchRequest {
    private final URI url;
    private final String method;
    private final Map<String, String> queryParams;
    private final Map<String, String> formFields;
    private final Map<String, String> headerOverrides;

    private FetchRequest(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.method = b.method;
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(b.queryParams));
        this.formFields = Collections.unmodifiableMap(new LinkedHashMap<>(b.formFields));
        this.headerOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.headerOverrides));
    }

    public static FetchRequest get(URI url) { return builder(url).build(); }

    public static Builder builder(URI url) { return new Builder(url); }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public Map<String, String> getQueryParams() { return queryParams; }
    public Map<String, String> getFormFields() { return formFields; }
    public Map<String, String> getHeaderOverrides() { return headerOverrides; }

    public boolean hasBody() { return !formFields.isEmpty(); }

    @Override public String toString() { return method + " " + url; }

    public static final class Builder {
        private final URI url;
        private String method = "GET";
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private final Map<String, String> formFields = new LinkedHashMap<>();
        private final Map<String, String> headerOverrides = new LinkedHashMap<>();

        private Builder(URI url) { this.url = url; }

        public Builder method(String m) {
            this.method = (m == null || m.isBlank()) ? "GET" : m.trim().toUpperCase(Locale.ROOT);
            return this;
        }
        public Builder param(String key, String value) {
            queryParams.remove(key); // 재삽입 시 마지막 위치로
            queryParams.put(Objects.requireNonNull(key, "key"), value == null ? "" : value);
            return this;
        }
        public Builder formField(String key, String value) {
            formFields.put(Objects.requireNonNull(key, "key"), value == null ? "" : value);
            return this;
        }
        public Builder header(String name, String value) {
            headerOverrides.put(Objects.requireNonNull(name, "name"), value == null ? "" : value);
            return this;
        }
        public FetchRequest build() { return new FetchRequest(this); }
    }
}
