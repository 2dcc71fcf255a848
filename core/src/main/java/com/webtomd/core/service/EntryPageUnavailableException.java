package com.webtomd.core.service;

/** 진입 페이지를 가져오지 못함 */
public class EntryPageUnavailableException extends CrawlException {
    public EntryPageUnavailableException(String url, String reason) {
        super(CrawlState.FETCH_ENTRY, "cannot retrieve entry page: " + url + " (" + reason + ")");
    }
}
