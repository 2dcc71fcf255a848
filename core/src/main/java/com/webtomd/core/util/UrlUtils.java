package com.webtomd.core.util;

import org.jsoup.internal.StringUtil;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * href 해석/정규화 유틸.
 *
 * 규칙(순서대로):
 * - http(s):// 절대 URL은 그대로
 * - //host/... 는 base의 scheme을 물려받음
 * - /path 는 base의 scheme://authority 뒤에 붙임
 * - 그 외는 base 기준 표준 상대 URL 해석
 * 해석 후 fragment는 항상 제거(#만 다른 URL은 같은 페이지).
 */
public final class UrlUtils {
    private UrlUtils() {}

    /**
     * 크롤 대상 링크로 쓸 수 있으면 fragment 제거된 절대 URL, 아니면 null.
     * 거부: '#'로 시작, 'javascript:'로 시작, 해석 결과의 마지막 경로 조각이 '#'로 시작, 해석 실패.
     */
    public static String normalizeHref(String href, String baseUrl) {
        if (href == null) return null;
        String h = href.trim();
        if (h.startsWith("#")) return null;
        if (h.toLowerCase(Locale.ROOT).startsWith("javascript:")) return null;

        String resolved;
        if (isAbsoluteHttp(h)) {
            resolved = h;
        } else if (h.startsWith("//")) {
            String scheme = schemeOf(baseUrl);
            if (scheme == null) return null;
            resolved = scheme + ":" + h;
        } else if (h.startsWith("/")) {
            String scheme = schemeOf(baseUrl);
            String authority = authorityOf(baseUrl);
            if (scheme == null || authority == null) return null;
            resolved = scheme + "://" + authority + h;
        } else {
            resolved = resolve(baseUrl, h);
        }
        if (resolved == null) return null;
        if (lastSegment(resolved).startsWith("#")) return null;
        return stripFragment(resolved);
    }

    /**
     * 표준 상대 URL 해석(jsoup abs:href와 동일 규칙). 실패하면 null.
     * "?q" 는 현재 경로 유지, 루트 위로 올라가는 ".." 는 버린다.
     */
    public static String resolve(String baseUrl, String href) {
        if (baseUrl == null || href == null) return null;
        String r = StringUtil.resolve(baseUrl, href);
        return r.isEmpty() ? null : r;
    }

    /** 첫 '#' 이후 제거 */
    public static String stripFragment(String url) {
        if (url == null) return null;
        int i = url.indexOf('#');
        return (i < 0) ? url : url.substring(0, i);
    }

    public static boolean isAbsoluteHttp(String url) {
        if (url == null) return false;
        String l = url.toLowerCase(Locale.ROOT);
        return l.startsWith("http://") || l.startsWith("https://");
    }

    /** 끝의 '/'를 모두 제거 */
    public static String stripTrailingSlashes(String url) {
        if (url == null) return null;
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') end--;
        return url.substring(0, end);
    }

    /** 처음 등장 순서를 유지한 중복 제거 */
    public static List<String> distinctInOrder(Collection<String> urls) {
        return List.copyOf(new ArrayList<>(new LinkedHashSet<>(urls)));
    }

    public static String schemeOf(String url) {
        URL u = parse(url);
        return (u == null) ? null : u.getProtocol();
    }

    /** host[:port] (userinfo 포함 시 그대로) */
    public static String authorityOf(String url) {
        URL u = parse(url);
        return (u == null) ? null : u.getAuthority();
    }

    /** 경로 부분, 없으면 "" */
    public static String pathOf(String url) {
        URL u = parse(url);
        if (u == null || u.getPath() == null) return "";
        return u.getPath();
    }

    private static String lastSegment(String url) {
        int i = url.lastIndexOf('/');
        return (i < 0) ? url : url.substring(i + 1);
    }

    private static URL parse(String url) {
        if (url == null) return null;
        try {
            return new URL(url);
        } catch (MalformedURLException e) {
            return null;
        }
    }
}
