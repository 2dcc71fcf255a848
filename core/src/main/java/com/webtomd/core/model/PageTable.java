package com.webtomd.core.model;

import com.webtomd.core.util.UrlUtils;

import java.util.*;

/**
 * URL → PageRecord 순서 보존 테이블. 삽입 순서 = 발견 순서(엔트리 페이지가 첫 번째).
 * 가져오기 실패한 URL은 들어오지 않는다.
 */
public final class PageTable {

    private final LinkedHashMap<String, PageRecord> pages = new LinkedHashMap<>();

    /** 같은 URL을 두 번 넣으면 IllegalStateException */
    public void add(PageRecord page) {
        Objects.requireNonNull(page, "page");
        if (pages.containsKey(page.url())) {
            throw new IllegalStateException("duplicate page url: " + page.url());
        }
        pages.put(page.url(), page);
    }

    public boolean contains(String url) { return pages.containsKey(url); }
    public Optional<PageRecord> get(String url) { return Optional.ofNullable(pages.get(url)); }
    public int size() { return pages.size(); }
    public boolean isEmpty() { return pages.isEmpty(); }

    /** 삽입 순서 그대로의 읽기 전용 뷰 */
    public List<PageRecord> records() { return List.copyOf(pages.values()); }
    public List<String> urls() { return List.copyOf(pages.keySet()); }

    /**
     * 마크다운 링크 대상이 크롤한 페이지인지 찾는다.
     * 완전 일치 또는 끝 슬래시를 무시한 일치, 삽입 순서상 첫 번째가 이긴다.
     */
    public Optional<PageRecord> findByLink(String href) {
        if (href == null) return Optional.empty();
        String h = UrlUtils.stripTrailingSlashes(href);
        for (PageRecord p : pages.values()) {
            if (href.equals(p.url()) || h.equals(UrlUtils.stripTrailingSlashes(p.url()))) return Optional.of(p);
        }
        return Optional.empty();
    }
}
