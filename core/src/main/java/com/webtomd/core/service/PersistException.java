package com.webtomd.core.service;

import java.io.IOException;
import java.nio.file.Path;

/** 최종 문서 저장 실패 */
public class PersistException extends CrawlException {
    public PersistException(Path target, IOException cause) {
        super(CrawlState.PERSIST, "cannot write document " + target + ": " + cause.getMessage(), cause);
    }
}
