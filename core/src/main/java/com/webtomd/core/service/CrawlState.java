package com.webtomd.core.service;

/** 한 번의 크롤 실행 단계. FAILED는 흡수 상태. */
public enum CrawlState {
    IDLE,
    FETCH_ENTRY,
    LOCATE_CONTAINER,
    EXTRACT_LINKS,
    FETCH_ALL,
    CONVERT,
    ASSEMBLE,
    PERSIST,
    DONE,
    FAILED
}
