package com.webtomd.core.service.export;

import com.webtomd.core.util.UrlUtils;

import java.nio.file.Path;
import java.util.regex.Pattern;

/** 산출물 경로 규칙: &lt;root&gt;/&lt;host&gt;/&lt;filename&gt;, HTML 캐시는 &lt;root&gt;/ori_html/&lt;host&gt;/&lt;safe&gt;.html */
public final class OutputNaming {
    private OutputNaming() {}

    public static final String HTML_CACHE_DIR = "ori_html";
    public static final String UNKNOWN_HOST = "unknown-host";

    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\-_.]+", Pattern.UNICODE_CHARACTER_CLASS);

    /** base URL의 authority, 안전하지 않은 문자 구간은 '_' */
    public static String hostFolder(String baseUrl) {
        String authority = UrlUtils.authorityOf(baseUrl);
        if (authority == null || authority.isEmpty()) return UNKNOWN_HOST;
        return UNSAFE.matcher(authority).replaceAll("_");
    }

    public static Path documentPath(Path outputRoot, String baseUrl, String filename) {
        return outputRoot.resolve(hostFolder(baseUrl)).resolve(filename);
    }

    public static Path htmlCachePath(Path outputRoot, String baseUrl, String pageUrl) {
        return outputRoot.resolve(HTML_CACHE_DIR)
                .resolve(hostFolder(baseUrl))
                .resolve(safeFilename(pageKey(pageUrl), ".html"));
    }

    /** URL 경로 기반 페이지 키: 없으면 "index", '/'로 끝나면 "index"를 덧붙인다 */
    public static String pageKey(String pageUrl) {
        String path = UrlUtils.pathOf(pageUrl);
        if (path.isEmpty()) return "index";
        return path.endsWith("/") ? path + "index" : path;
    }

    /** 앞의 '/' 제거 → 안전하지 않은 문자 구간 '_' → 비면 "index" → 확장자 */
    public static String safeFilename(String urlPath, String ext) {
        String p = (urlPath == null) ? "" : urlPath;
        int i = 0;
        while (i < p.length() && p.charAt(i) == '/') i++;
        String safe = UNSAFE.matcher(p.substring(i)).replaceAll("_");
        if (safe.isEmpty()) safe = "index";
        return safe + (ext == null ? "" : ext);
    }
}
