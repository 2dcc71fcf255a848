package com.webtomd.core.model;

import java.util.Locale;

/** DOM 노드 지정 방식(selector family): class 포함 / id 일치 / 태그명 일치. */
public enum SelectorType {
    CLASS, ID, TAG;

    /** "class" | "id" | "tag" (대소문자 무시). 그 외 값은 IllegalArgumentException. */
    public static SelectorType parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("selector type is required (class|id|tag)");
        }
        String v = s.trim().toUpperCase(Locale.ROOT);
        for (SelectorType t : values()) {
            if (t.name().equals(v)) return t;
        }
        throw new IllegalArgumentException("Unsupported selector type: " + s + " (use class|id|tag)");
    }

    /** 설정 파일/로그 표기용 소문자 이름 */
    public String key() { return name().toLowerCase(Locale.ROOT); }
}
