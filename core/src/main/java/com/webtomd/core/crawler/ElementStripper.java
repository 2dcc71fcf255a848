package com.webtomd.core.crawler;

import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.SelectorType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/** 선택자에 걸리는 요소를 하위 트리째 제거하고 다시 HTML로 직렬화. */
public final class ElementStripper {
    private ElementStripper() {}

    /** pipeValues: "a|b|c" 형식. 비었거나 null이면 입력 그대로 반환 */
    public static String strip(String html, SelectorType type, String pipeValues) {
        return strip(html, type, CrawlConfig.splitValues(pipeValues));
    }

    public static String strip(String html, SelectorType type, List<String> values) {
        if (html == null) return "";
        if (type == null || values == null || values.isEmpty()) return html;
        Document doc = Jsoup.parse(html);
        strip(doc, type, values);
        return serialize(doc);
    }

    /** 문서를 직접 수정. 제거한 요소 수 반환 */
    public static int strip(Document doc, SelectorType type, List<String> values) {
        if (doc == null || type == null || values == null) return 0;
        int removed = 0;
        for (String v : values) {
            for (Element el : ElementLocator.locate(doc, type, v)) {
                // 조상이 먼저 지워졌으면 이미 문서 밖
                if (el.ownerDocument() != doc) continue;
                el.remove();
                removed++;
            }
        }
        return removed;
    }

    /** 들여쓰기 없이 원본 공백 유지 */
    static String serialize(Document doc) {
        doc.outputSettings().prettyPrint(false);
        return doc.outerHtml();
    }
}
