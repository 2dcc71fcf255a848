package com.webtomd.core.convert;

import com.webtomd.core.api.ILinkRewriter;
import com.webtomd.core.model.PageRecord;
import com.webtomd.core.model.PageTable;
import com.webtomd.core.util.UrlUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 텍스트 기준 링크 보정(정규식 2회 통과).
 * 1) [text](href): 크롤한 페이지면 [text](#slug), 상대 링크면 pageUrl 기준 절대화
 * 2) ![alt](src): 상대 경로면 pageUrl 기준 절대화(앵커로 바꾸지 않음)
 */
public class RegexLinkRewriter implements ILinkRewriter {

    private static final Pattern LINK = Pattern.compile("(?<!!)\\[([^\\]]+)\\]\\(([^)]+)\\)");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(([^)]+)\\)");

    @Override
    public String rewriteLinks(String markdown, PageTable pages, String pageUrl) {
        if (markdown == null || markdown.isEmpty()) return "";
        String md = rewriteAnchors(markdown, pages, pageUrl);
        return rewriteImages(md, pageUrl);
    }

    String rewriteAnchors(String markdown, PageTable pages, String pageUrl) {
        Matcher m = LINK.matcher(markdown);
        StringBuilder sb = new StringBuilder(markdown.length());
        while (m.find()) {
            String text = m.group(1);
            String href = m.group(2);
            String target;
            Optional<PageRecord> page = (pages == null) ? Optional.empty() : pages.findByLink(href);
            if (page.isPresent()) {
                target = "#" + page.get().anchorSlug();
            } else if (!UrlUtils.isAbsoluteHttp(href) && !href.startsWith("#")) {
                target = resolveOrKeep(pageUrl, href);
            } else {
                target = href;
            }
            m.appendReplacement(sb, Matcher.quoteReplacement("[" + text + "](" + target + ")"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    String rewriteImages(String markdown, String pageUrl) {
        Matcher m = IMAGE.matcher(markdown);
        StringBuilder sb = new StringBuilder(markdown.length());
        while (m.find()) {
            String alt = m.group(1);
            String src = m.group(2);
            String target = UrlUtils.isAbsoluteHttp(src) ? src : resolveOrKeep(pageUrl, src);
            m.appendReplacement(sb, Matcher.quoteReplacement("![" + alt + "](" + target + ")"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String resolveOrKeep(String pageUrl, String href) {
        String r = UrlUtils.resolve(pageUrl, href);
        return (r == null) ? href : r;
    }
}
