package com.webtomd.core.service;

/** 크롤 실행을 중단시키는 오류. 어느 단계에서 실패했는지 함께 담는다. */
public class CrawlException extends Exception {
    private final CrawlState stage;

    public CrawlException(CrawlState stage, String message) {
        super(message);
        this.stage = stage;
    }

    public CrawlException(CrawlState stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public CrawlState getStage() { return stage; }
}
