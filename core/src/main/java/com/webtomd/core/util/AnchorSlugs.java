package com.webtomd.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 페이지 제목 → 문서 내 앵커 slug.
 * 소문자화 후 (유니코드)단어 문자와 '-' 이외는 모두 제거한다. 충돌은 해결하지 않는다.
 */
public final class AnchorSlugs {
    private AnchorSlugs() {}

    private static final Pattern NON_SLUG = Pattern.compile("[^\\w\\-]+", Pattern.UNICODE_CHARACTER_CLASS);

    public static String slugOf(String title) {
        if (title == null) return "";
        return NON_SLUG.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
