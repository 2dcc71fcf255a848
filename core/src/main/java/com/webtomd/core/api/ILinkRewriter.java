// ILinkRewriter.java
package com.webtomd.core.api;

import com.webtomd.core.model.PageTable;

/**
 * 변환된 마크다운의 링크/이미지 재작성 계약.
 * 크롤한 페이지로 가는 링크는 문서 내 앵커로, 나머지 상대 링크는 절대 URL로 바꾼다.
 */
public interface ILinkRewriter {
    /**
     * @param markdown 변환 결과
     * @param pages    가져오기에 성공한 페이지 전체(제목/slug 포함)
     * @param pageUrl  상대 링크 해석 기준(해당 페이지 자신의 URL)
     */
    String rewriteLinks(String markdown, PageTable pages, String pageUrl);
}
