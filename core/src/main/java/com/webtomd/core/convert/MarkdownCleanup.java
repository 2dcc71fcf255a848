package com.webtomd.core.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** 변환 직후 후처리: 연속 빈 줄 합치기, 남은 &lt;a&gt; 태그 제거(텍스트는 유지). */
public final class MarkdownCleanup {
    private MarkdownCleanup() {}

    private static final Pattern ANCHOR_PAIR =
            Pattern.compile("<a [^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ANCHOR_SELF_CLOSING =
            Pattern.compile("<a [^>]*/>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static String clean(String markdown) {
        return stripAnchorTags(collapseBlankLines(markdown));
    }

    /** 공백뿐인 줄이 이어지면 첫 줄만 남긴다. 두 번 적용해도 결과 같음 */
    public static String collapseBlankLines(String markdown) {
        if (markdown == null) return "";
        String[] lines = markdown.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        boolean prevBlank = false;
        for (String line : lines) {
            if (line.isBlank()) {
                if (!prevBlank) kept.add(line);
                prevBlank = true;
            } else {
                kept.add(line);
                prevBlank = false;
            }
        }
        return String.join("\n", kept);
    }

    public static String stripAnchorTags(String markdown) {
        if (markdown == null) return "";
        String md = ANCHOR_PAIR.matcher(markdown).replaceAll("$1");
        return ANCHOR_SELF_CLOSING.matcher(md).replaceAll("");
    }
}
