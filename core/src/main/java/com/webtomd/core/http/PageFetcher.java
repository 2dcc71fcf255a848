package com.webtomd.core.http;

import com.webtomd.core.api.IPageFetcher;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.FetchResult;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 페이지 HTML 가져오기: GET 1회, 고정 타임아웃/UA, 재시도 없음.
 * 본문은 Content-Type의 charset, 없으면 jsoup가 감지한 charset(BOM/meta), 그래도 없으면 UTF-8로 디코딩.
 */
public class PageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws Exception;
    }

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final Logger log;

    public PageFetcher(CrawlConfig config) {
        this(config, LoggerFactory.getLogger(PageFetcher.class));
    }

    public PageFetcher(CrawlConfig config, Logger log) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        this.sender = null;
        this.log = Objects.requireNonNull(log, "log");
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public PageFetcher(CrawlConfig config, HttpSender testSender, Logger log) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public FetchResult fetch(String url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        log.info("Fetching page: {}", url);
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();

            HttpResponse<byte[]> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofByteArray());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            int status = resp.statusCode();
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);

            if (status < 200 || status >= 300) {
                log.warn("Fetch failed {}: HTTP {}", url, status);
                return FetchResult.builder()
                        .url(url)
                        .statusCode(status)
                        .contentType(contentType)
                        .responseTimeMs(elapsedMs)
                        .build();
            }

            byte[] bytes = (resp.body() == null) ? new byte[0] : resp.body();
            Charset cs = charsetOf(contentType);
            if (cs == null) cs = sniffCharset(bytes, url);
            String body = new String(bytes, cs);

            log.info("Fetched {} (status={}, charset={}, {} chars, {} ms)",
                    url, status, cs.name(), body.length(), elapsedMs);
            return FetchResult.builder()
                    .url(url)
                    .statusCode(status)
                    .body(body)
                    .contentType(contentType)
                    .charset(cs.name())
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (HttpTimeoutException e) {
            log.warn("Fetch timed out {} after {}", url, timeout);
            return failed(url, start, "timeout after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch interrupted {}", url);
            return failed(url, start, "interrupted");
        } catch (Exception e) {
            log.warn("Fetch failed {}: {}", url, e.toString());
            return failed(url, start, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static FetchResult failed(String url, long start, String error) {
        return FetchResult.builder()
                .url(url)
                .statusCode(-1)
                .responseTimeMs((System.nanoTime() - start) / 1_000_000)
                .error(error)
                .build();
    }

    /** "text/html; charset=EUC-KR" → EUC-KR. 없거나 모르는 이름이면 null */
    static Charset charsetOf(String contentType) {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).trim().replace("\"", "").replace("'", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /** jsoup의 BOM/meta 감지 결과. 실패하면 UTF-8 */
    private Charset sniffCharset(byte[] bytes, String url) {
        try {
            return Jsoup.parse(new ByteArrayInputStream(bytes), null, url).charset();
        } catch (Exception e) {
            log.debug("Charset sniffing failed for {}: {}", url, e.getMessage());
            return StandardCharsets.UTF_8;
        }
    }
}
