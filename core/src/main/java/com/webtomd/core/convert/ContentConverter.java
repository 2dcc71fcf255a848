package com.webtomd.core.convert;

import com.webtomd.core.api.IMarkdownConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** HTML 조각 → 정리된 Markdown. 예외를 던지지 않고 실패 시 원본을 담은 대체 텍스트를 돌려준다. */
public class ContentConverter {
    static final String FAILURE_PREFIX = "Conversion failed: ";
    static final String ORIGINAL_HEADER = "\n\nOriginal content:\n";

    private final IMarkdownConverter delegate;
    private final Logger log;

    public ContentConverter() {
        this(new FlexmarkMarkdownConverter(), LoggerFactory.getLogger(ContentConverter.class));
    }

    public ContentConverter(IMarkdownConverter delegate, Logger log) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.log = Objects.requireNonNull(log, "log");
    }

    public ConversionResult convert(String html) {
        String source = (html == null) ? "" : html;
        try {
            String md = MarkdownCleanup.clean(delegate.convert(source));
            log.debug("Converted {} chars of HTML to {} chars of Markdown", source.length(), md.length());
            return ConversionResult.ok(md);
        } catch (Exception e) {
            String msg = (e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName();
            log.error("HTML to Markdown conversion failed: {}", msg, e);
            return ConversionResult.degraded(FAILURE_PREFIX + msg + ORIGINAL_HEADER + source, msg);
        }
    }

    public String toMarkdown(String html) {
        return convert(html).markdown();
    }
}
