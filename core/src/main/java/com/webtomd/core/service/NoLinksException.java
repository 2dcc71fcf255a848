package com.webtomd.core.service;

/** 컨테이너는 있지만 쓸 수 있는 링크가 하나도 없음 */
public class NoLinksException extends CrawlException {
    public NoLinksException(int containers) {
        super(CrawlState.EXTRACT_LINKS, "no links discovered in " + containers + " container(s)");
    }
}
