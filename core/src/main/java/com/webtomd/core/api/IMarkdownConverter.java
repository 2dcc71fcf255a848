// IMarkdownConverter.java
package com.webtomd.core.api;

/** HTML → Markdown 변환기(외부 라이브러리 래핑 지점). 실패 처리는 호출자 몫. */
@FunctionalInterface
public interface IMarkdownConverter {
    String convert(String html) throws Exception;
}
