package com.webtomd.core.model;

import java.util.Objects;

/** 페이지 1회 요청 결과(본문은 디코딩된 텍스트). 실패해도 예외 대신 이 객체로 돌려준다. */
public final class FetchResult {
    private final String url;
    private final int statusCode;       // 전송 실패/타임아웃이면 -1
    private final String body;
    private final String contentType;
    private final String charset;
    private final long responseTimeMs;
    private final String error;         // 실패 사유(성공이면 null)

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.charset = b.charset;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public String getCharset() { return charset; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public String getError() { return error; }

    /** 2xx + 전송 오류 없음 */
    public boolean isOk() {
        return error == null && statusCode >= 200 && statusCode < 300;
    }

    /** 로그/리포트용 실패 사유 한 줄 */
    public String failureReason() {
        if (isOk()) return null;
        if (error != null) return error;
        return "HTTP " + statusCode;
    }

    // ----- 편의 팩토리 -----
    public static FetchResult ok(String url, String body) {
        return builder().url(url).statusCode(200).body(body).build();
    }

    public static FetchResult failed(String url, int statusCode, String error) {
        return builder().url(url).statusCode(statusCode).error(error).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private String body;
        private String contentType;
        private String charset;
        private long responseTimeMs;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder charset(String charset) { this.charset = charset; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
