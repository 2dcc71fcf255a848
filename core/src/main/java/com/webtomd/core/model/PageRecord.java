package com.webtomd.core.model;

import java.util.Objects;

/**
 * 가져오기에 성공한 페이지 1건.
 *
 * @param url        fragment 제거된 정규 URL
 * @param html       사전 제거까지 끝난 HTML (이후 다시 가공하지 않음)
 * @param title      문서 제목, 없으면 URL 경로
 * @param anchorSlug 제목에서 만든 문서 내 앵커
 */
public record PageRecord(String url, String html, String title, String anchorSlug) {
    public PageRecord {
        Objects.requireNonNull(url, "url");
        html = (html == null) ? "" : html;
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(anchorSlug, "anchorSlug");
    }
}
