package com.webtomd.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * 정상 종료된 크롤 결과.
 *
 * @param document 저장된 마크다운 파일 경로
 * @param pages    문서에 포함된 페이지 URL(테이블 순서)
 * @param failures 건너뛰었거나(FETCH) 대체 출력된(CONVERSION) 페이지
 */
public record CrawlReport(Path document, List<String> pages, List<PageFailure> failures) {
    public CrawlReport {
        pages = (pages == null) ? List.of() : List.copyOf(pages);
        failures = (failures == null) ? List.of() : List.copyOf(failures);
    }
}
