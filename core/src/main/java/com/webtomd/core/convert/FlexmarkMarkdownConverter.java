package com.webtomd.core.convert;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.webtomd.core.api.IMarkdownConverter;

/**
 * flexmark HTML → Markdown.
 * 링크/이미지 유지, ATX 제목(#), 제목 id 속성 출력 안 함, 줄바꿈 래핑 없음.
 */
public class FlexmarkMarkdownConverter implements IMarkdownConverter {
    private final FlexmarkHtmlConverter converter;

    public FlexmarkMarkdownConverter() {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.OUTPUT_ATTRIBUTES_ID, false);
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
    }

    @Override
    public String convert(String html) {
        return converter.convert(html == null ? "" : html);
    }
}
