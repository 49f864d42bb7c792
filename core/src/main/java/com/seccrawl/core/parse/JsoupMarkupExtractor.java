package com.seccrawl.core.parse;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.error.MarkupParseException;
import com.seccrawl.core.model.ExtractedElement;
import com.seccrawl.core.model.FetchOutcome;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** 기본 jsoup 기반 추출기: title/text/a[href]/img[src]/meta 수집 + CSS 셀렉터 매칭 */
public class JsoupMarkupExtractor implements MarkupExtractor {

    @Override
    public Page parsePage(FetchOutcome.Success response) {
        String base = response.finalUrl().toString();
        try {
            Document doc = Jsoup.parse(response.body(), base);

            Page.Builder b = Page.builder(base)
                    .statusCode(response.status())
                    .headers(response.headers())
                    .html(response.body())
                    .text(doc.text());

            Element title = doc.selectFirst("title");
            if (title != null) b.title(title.text());

            for (Element a : doc.select("a[href]")) {
                String abs = absolute(a, "href");
                if (abs != null) b.link(abs);
            }
            for (Element img : doc.select("img[src]")) {
                String abs = absolute(img, "src");
                if (abs != null) b.image(abs);
            }
            for (Element meta : doc.select("meta[name]")) {
                b.meta(meta.attr("name"), meta.attr("content"));
            }
            return b.build();
        } catch (RuntimeException e) {
            throw new MarkupParseException("Error parsing page " + base + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ExtractedElement> select(String html, String baseUrl, String selector) {
        Elements found = query(Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl), selector);
        List<ExtractedElement> out = new ArrayList<>(found.size());
        for (Element e : found) {
            Map<String, String> attrs = new LinkedHashMap<>();
            for (Attribute a : e.attributes()) attrs.put(a.getKey(), a.getValue());
            out.add(new ExtractedElement(e.outerHtml(), e.text(), attrs));
        }
        return out;
    }

    @Override
    public Optional<String> firstLink(String html, String baseUrl, String selector, String attr) {
        Elements found = query(Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl), selector);
        if (found.isEmpty()) return Optional.empty();
        Element first = found.first();
        if (first == null || !first.hasAttr(attr)) return Optional.empty();
        return Optional.ofNullable(absolute(first, attr));
    }

    private static Elements query(Document doc, String selector) {
        if (selector == null || selector.isBlank()) throw new ConfigurationException("selector must not be blank");
        try {
            return doc.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            // 괄호 불균형 등은 jsoup 이 IllegalArgumentException 으로 알린다
            throw new ConfigurationException("invalid selector '" + selector + "': " + e.getMessage(), e);
        }
    }

    /** jsoup abs: 해석 실패(알 수 없는 스킴 등)면 직접 URL join, 그래도 안 되면 null */
    private static String absolute(Element el, String attr) {
        String abs = el.absUrl(attr);
        if (!abs.isEmpty()) return abs;
        return UrlUtils.resolve(el.baseUri(), el.attr(attr));
    }
}
