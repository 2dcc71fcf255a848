package com.webtomd.core.model;

import java.util.List;

/**
 * 최종 산출물: 배너 + 목차 + 페이지 섹션들. render()로 한 번만 직렬화한다.
 */
public record AssembledDocument(String banner, String tableOfContents, List<Section> sections) {

    public static final String SEPARATOR = "\n\n---\n\n";

    public AssembledDocument {
        sections = (sections == null) ? List.of() : List.copyOf(sections);
    }

    /** 페이지 1개 분량: "# 제목" + 본문 */
    public record Section(String title, String anchorSlug, String body) {
        String render() {
            return "# " + title + "\n\n" + (body == null ? "" : body) + SEPARATOR;
        }
    }

    public String render() {
        StringBuilder sb = new StringBuilder(banner).append(tableOfContents);
        for (Section s : sections) sb.append(s.render());
        return sb.toString();
    }
}
