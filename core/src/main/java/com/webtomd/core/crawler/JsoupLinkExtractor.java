package com.webtomd.core.crawler;

import com.webtomd.core.util.UrlUtils;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 기본 JSoup 기반 링크 추출기: 컨테이너별 a[href] → normalizeHref */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<String> extract(List<Element> containers, String baseUrl) {
        List<String> out = new ArrayList<>();
        if (containers == null || baseUrl == null) return out;

        for (Element container : containers) {
            for (Element a : container.select("a[href]")) {
                String normalized = UrlUtils.normalizeHref(a.attr("href"), baseUrl);
                if (normalized != null) out.add(normalized);
            }
        }
        return UrlUtils.distinctInOrder(out);
    }
}
