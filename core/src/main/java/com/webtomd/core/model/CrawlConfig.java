package com.webtomd.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 한 번의 크롤 실행 설정. build() 시점에 한 번 검증되고 이후 변경되지 않는다.
 *
 * 필수: baseUrl, selectorType, selectorValue
 * 옵션: preRemoveType/preRemoveValue (둘 다 있어야 사전 제거 활성), outputFilename,
 *       outputRoot, timeout, userAgent, requestDelay
 */
public final class CrawlConfig {

    public static final String DEFAULT_FILENAME = "all_in_one.md";
    public static final Path DEFAULT_OUTPUT_ROOT = Path.of("downloads");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    private final String baseUrl;
    private final SelectorType selectorType;
    private final String selectorValue;
    private final SelectorType preRemoveType;   // null 허용
    private final String preRemoveValue;        // null 허용, '|' 구분
    private final String outputFilename;
    private final Path outputRoot;
    private final Duration timeout;
    private final String userAgent;
    private final Duration requestDelay;

    private CrawlConfig(Builder b) {
        this.baseUrl = b.baseUrl;
        this.selectorType = b.selectorType;
        this.selectorValue = b.selectorValue;
        this.preRemoveType = b.preRemoveType;
        this.preRemoveValue = b.preRemoveValue;
        this.outputFilename = b.outputFilename;
        this.outputRoot = b.outputRoot;
        this.timeout = b.timeout;
        this.userAgent = b.userAgent;
        this.requestDelay = b.requestDelay;
    }

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public SelectorType getSelectorType() { return selectorType; }
    public String getSelectorValue() { return selectorValue; }
    public SelectorType getPreRemoveType() { return preRemoveType; }
    public String getPreRemoveValue() { return preRemoveValue; }
    public String getOutputFilename() { return outputFilename; }
    public Path getOutputRoot() { return outputRoot; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public Duration getRequestDelay() { return requestDelay; }

    /** 타입과 값이 모두 있어야 사전 제거가 켜진다. 하나라도 없으면 항등 변환. */
    public boolean isPreRemovalEnabled() {
        return preRemoveType != null && !preRemoveValues().isEmpty();
    }

    /** '|'로 나눈 사전 제거 대상 값 목록(공백 항목 제외) */
    public List<String> preRemoveValues() {
        return splitValues(preRemoveValue);
    }

    public static List<String> splitValues(String pipeDelimited) {
        if (pipeDelimited == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String v : pipeDelimited.split("\\|")) {
            String t = v.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return List.copyOf(out);
    }

    public Builder toBuilder() {
        return new Builder()
                .baseUrl(baseUrl)
                .selector(selectorType, selectorValue)
                .preRemove(preRemoveType, preRemoveValue)
                .outputFilename(outputFilename)
                .outputRoot(outputRoot)
                .timeout(timeout)
                .userAgent(userAgent)
                .requestDelay(requestDelay);
    }

    @Override public String toString() {
        return "CrawlConfig{baseUrl=" + baseUrl
                + ", selector=" + (selectorType == null ? null : selectorType.key()) + ":" + selectorValue
                + ", preRemove=" + (preRemoveType == null ? null : preRemoveType.key()) + ":" + preRemoveValue
                + ", output=" + outputRoot + "/" + outputFilename + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String baseUrl;
        private SelectorType selectorType;
        private String selectorValue;
        private SelectorType preRemoveType;
        private String preRemoveValue;
        private String outputFilename = DEFAULT_FILENAME;
        private Path outputRoot = DEFAULT_OUTPUT_ROOT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private String userAgent = DEFAULT_USER_AGENT;
        private Duration requestDelay = Duration.ZERO;

        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder selector(SelectorType type, String value) {
            this.selectorType = type;
            this.selectorValue = value;
            return this;
        }
        /** 문자열 타입 버전: 잘못된 타입은 여기서 바로 거부 */
        public Builder selector(String type, String value) {
            return selector(SelectorType.parse(type), value);
        }
        public Builder preRemove(SelectorType type, String value) {
            this.preRemoveType = type;
            this.preRemoveValue = value;
            return this;
        }
        /** type이 null/공백이면 사전 제거 비활성 */
        public Builder preRemove(String type, String value) {
            SelectorType t = (type == null || type.isBlank()) ? null : SelectorType.parse(type);
            return preRemove(t, value);
        }
        public Builder outputFilename(String outputFilename) { this.outputFilename = outputFilename; return this; }
        public Builder outputRoot(Path outputRoot) { this.outputRoot = outputRoot; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        public Builder requestDelay(Duration requestDelay) { this.requestDelay = requestDelay; return this; }

        public CrawlConfig build() {
            Objects.requireNonNull(baseUrl, "baseUrl");
            String scheme;
            try {
                scheme = URI.create(baseUrl.trim()).getScheme();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("baseUrl is not a valid URL: " + baseUrl, e);
            }
            if (scheme == null || !(scheme.toLowerCase(Locale.ROOT).equals("http")
                    || scheme.toLowerCase(Locale.ROOT).equals("https"))) {
                throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
            }
            baseUrl = baseUrl.trim();

            Objects.requireNonNull(selectorType, "selectorType");
            if (selectorValue == null || selectorValue.isBlank())
                throw new IllegalArgumentException("selectorValue must not be blank");

            if (outputFilename == null || outputFilename.isBlank()) outputFilename = DEFAULT_FILENAME;
            Objects.requireNonNull(outputRoot, "outputRoot");
            if (timeout == null || timeout.isNegative() || timeout.isZero())
                throw new IllegalArgumentException("timeout must be > 0");
            if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
            if (requestDelay == null || requestDelay.isNegative()) requestDelay = Duration.ZERO;
            return new CrawlConfig(this);
        }
    }
}
