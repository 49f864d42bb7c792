package com.seccrawl.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** 페이지네이션 크롤에서 한 페이지분 추출 결과. */
@JsonPropertyOrder({"current_url", "data"})
public record ExtractionRecord(
        @JsonProperty("current_url") String sourceUrl,
        @JsonProperty("data") List<ExtractedElement> elements) implements CrawlRecord {

    public ExtractionRecord {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        elements = (elements == null) ? List.of() : List.copyOf(elements);
    }
}
