package com.seccrawl.core.parse;

import com.seccrawl.core.error.MarkupParseException;
import com.seccrawl.core.model.ExtractedElement;
import com.seccrawl.core.model.FetchOutcome;
import com.seccrawl.core.model.Page;

import java.util.List;
import java.util.Optional;

/** 마크업에서 페이지 정보/셀렉터 매칭을 뽑아내는 전략 인터페이스. */
public interface MarkupExtractor {

    /**
     * 응답 본문을 Page로 변환. 상대 링크/이미지는 response.finalUrl() 기준으로 절대화.
     * @throws MarkupParseException 추출 자체가 불가능한 경우
     */
    Page parsePage(FetchOutcome.Success response) throws MarkupParseException;

    /**
     * selector 매칭 요소를 문서 순서대로.
     * @throws com.seccrawl.core.error.ConfigurationException selector 문법 오류
     */
    List<ExtractedElement> select(String html, String baseUrl, String selector);

    /** selector 첫 매칭 요소의 attr 값을 절대 URL로. 요소나 속성이 없으면 empty. */
    Optional<String> firstLink(String html, String baseUrl, String selector, String attr);
}
