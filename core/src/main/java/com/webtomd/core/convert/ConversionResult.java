package com.webtomd.core.convert;

/**
 * 페이지 1건 변환 결과.
 * degraded=true면 markdown에는 실패 안내 + 원본 HTML이 들어 있다.
 */
public record ConversionResult(String markdown, boolean degraded, String error) {

    public static ConversionResult ok(String markdown) {
        return new ConversionResult(markdown, false, null);
    }

    public static ConversionResult degraded(String markdown, String error) {
        return new ConversionResult(markdown, true, error);
    }
}
