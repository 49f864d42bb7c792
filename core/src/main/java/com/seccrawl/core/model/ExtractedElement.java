package com.seccrawl.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 셀렉터에 매칭된 요소 1건.
 * @param html       요소의 직렬화 마크업(outerHtml)
 * @param text       공백 정리된 가시 텍스트
 * @param attributes 속성 이름→값(문서 순서)
 */
@JsonPropertyOrder({"html", "text", "attributes"})
public record ExtractedElement(
        @JsonProperty("html") String html,
        @JsonProperty("text") String text,
        @JsonProperty("attributes") Map<String, String> attributes) {

    public ExtractedElement {
        html = (html == null) ? "" : html;
        text = (text == null) ? "" : text;
        attributes = (attributes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
