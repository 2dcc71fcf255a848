package com.webtomd.core.crawler;

import com.webtomd.core.model.SelectorType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 진입 페이지가 아닌 페이지의 내비게이션 제거.
 * 1) 링크 컨테이너(크롤 선택자) 제거
 * 2) 문서/html/body 바로 아래에 있고 텍스트만 가진 &lt;a&gt; 제거
 */
public final class NavigationRemovalStep {
    private final SelectorType type;
    private final String value;

    public NavigationRemovalStep(SelectorType type, String value) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String apply(String html) {
        if (html == null) return "";
        Document doc = Jsoup.parse(html);
        ElementStripper.strip(doc, type, List.of(value));
        removeRootTextAnchors(doc);
        return ElementStripper.serialize(doc);
    }

    static int removeRootTextAnchors(Document doc) {
        List<Element> targets = new ArrayList<>();
        for (Element a : doc.getElementsByTag("a")) {
            if (isRootLevel(a) && hasOnlyText(a)) targets.add(a);
        }
        targets.forEach(Element::remove);
        return targets.size();
    }

    private static boolean isRootLevel(Element a) {
        Element p = a.parent();
        if (p == null || p instanceof Document) return true;
        String tag = p.normalName();
        return "body".equals(tag) || "html".equals(tag);
    }

    private static boolean hasOnlyText(Element a) {
        for (Node child : a.childNodes()) {
            if (!(child instanceof TextNode)) return false;
        }
        return true;
    }
}
