package com.webtomd.core.crawler;

import com.webtomd.core.model.SelectorType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * (타입, 값) 선택자로 요소 찾기.
 * - CLASS: class 목록에 값 포함(대소문자 구분)
 * - ID: id가 값과 같은 모든 요소(중복 id도 전부, 대소문자 구분)
 * - TAG: 태그 이름 일치(파서가 소문자로 정규화)
 * 예외를 던지지 않는다. 잘못된 입력이면 빈 목록.
 */
public final class ElementLocator {
    private ElementLocator() {}

    public static List<Element> locate(String html, SelectorType type, String value) {
        if (html == null) return List.of();
        return locate(Jsoup.parse(html), type, value);
    }

    public static List<Element> locate(Document doc, SelectorType type, String value) {
        if (doc == null || type == null || value == null || value.isBlank()) return List.of();
        String v = value.trim();
        try {
            switch (type) {
                case CLASS: return filter(doc.getElementsByAttribute("class"), el -> el.classNames().contains(v));
                case ID:    return filter(doc.getElementsByAttribute("id"), el -> v.equals(el.id()));
                case TAG:   return new ArrayList<>(doc.getElementsByTag(v));
                default:    return List.of();
            }
        } catch (RuntimeException e) {
            // jsoup Validate 실패(잘못된 태그명 등)는 "못 찾음"으로 본다
            return List.of();
        }
    }

    // jsoup getElementsByClass / getElementsByAttributeValue 는 대소문자 무시라 직접 거른다
    private static List<Element> filter(List<Element> candidates, Predicate<Element> match) {
        List<Element> out = new ArrayList<>();
        for (Element el : candidates) {
            if (match.test(el)) out.add(el);
        }
        return out;
    }
}
