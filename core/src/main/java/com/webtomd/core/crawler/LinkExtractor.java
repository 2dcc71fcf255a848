package com.webtomd.core.crawler;

import org.jsoup.nodes.Element;

import java.util.List;

/** 링크 컨테이너에서 크롤 대상 URL을 뽑는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * 컨테이너 안의 모든 a[href]를 baseUrl 기준으로 정규화해 반환.
     * 거부된 링크는 빠지고, 결과는 처음 등장 순서로 중복 제거된다.
     */
    List<String> extract(List<Element> containers, String baseUrl);
}
