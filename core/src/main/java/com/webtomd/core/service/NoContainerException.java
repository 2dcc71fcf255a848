package com.webtomd.core.service;

import com.webtomd.core.model.SelectorType;

/** 진입 페이지에 링크 컨테이너가 없음 */
public class NoContainerException extends CrawlException {
    public NoContainerException(SelectorType type, String value) {
        super(CrawlState.LOCATE_CONTAINER, "no link container found for " + type.key() + "=" + value);
    }
}
