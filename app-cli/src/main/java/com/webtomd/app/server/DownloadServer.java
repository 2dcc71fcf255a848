package com.webtomd.app.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.CrawlReport;
import com.webtomd.core.service.CrawlException;
import com.webtomd.core.service.CrawlService;
import com.webtomd.core.util.CrawlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 다운로드 HTTP 엔드포인트.
 *  POST /download/  {url, config:{type,value,...}, filename?, pre_remove_type?, pre_remove_value?}
 *  → 200 text/markdown + Content-Disposition(attachment; filename*=UTF-8''...)
 *  잘못된 요청 400, 크롤 실패 500, 둘 다 {"detail": "..."}; 그 외 메서드 405.
 * 요청은 한 번에 하나씩 처리한다(기본 실행기).
 */
public final class DownloadServer {

    public static final String PATH = "/download/";
    static final String DEFAULT_FILENAME = "tutorial.md";

    /** 크롤 실행 훅(테스트에서 네트워크 없이 대체) */
    @FunctionalInterface
    public interface CrawlRunner {
        CrawlReport run(CrawlConfig config) throws CrawlException;
    }

    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpServer server;
    private final Path outputRoot;
    private final Duration requestDelay;
    private final CrawlRunner runner;
    private final Logger log;

    public DownloadServer(InetSocketAddress address, Path outputRoot, Duration requestDelay) throws IOException {
        this(address, outputRoot, requestDelay, cfg -> new CrawlService(cfg).run(),
                LoggerFactory.getLogger(DownloadServer.class));
    }

    public DownloadServer(InetSocketAddress address, Path outputRoot, Duration requestDelay,
                          CrawlRunner runner, Logger log) throws IOException {
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
        this.requestDelay = (requestDelay == null) ? Duration.ZERO : requestDelay;
        this.runner = Objects.requireNonNull(runner, "runner");
        this.log = Objects.requireNonNull(log, "log");
        this.server = HttpServer.create(address, 0);
        this.server.createContext(PATH, this::handle);
    }

    public void start() {
        server.start();
        log.info("Download server listening on port {}", port());
    }

    public void stop() {
        server.stop(0);
        log.info("Download server stopped");
    }

    public int port() { return server.getAddress().getPort(); }

    // ================= handler =================
    void handle(HttpExchange ex) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
                ex.getResponseHeaders().set("Allow", "POST");
                sendDetail(ex, 405, "method not allowed");
                return;
            }

            DownloadRequest req;
            CrawlConfig config;
            try (InputStream in = ex.getRequestBody()) {
                req = OM.readValue(in, DownloadRequest.class);
                config = toCrawlConfig(req);
            } catch (JsonProcessingException e) {
                log.warn("Rejected download request: malformed JSON ({})", e.getOriginalMessage());
                sendDetail(ex, 400, "malformed JSON body: " + e.getOriginalMessage());
                return;
            } catch (IllegalArgumentException | NullPointerException e) {
                log.warn("Rejected download request: {}", e.getMessage());
                sendDetail(ex, 400, String.valueOf(e.getMessage()));
                return;
            }

            log.info("Download request: url={} filename={}", config.getBaseUrl(), config.getOutputFilename());
            CrawlReport report;
            try {
                report = runner.run(config);
            } catch (CrawlException e) {
                sendDetail(ex, 500, e.getMessage());
                return;
            }

            Path doc = report.document();
            if (doc == null || !Files.isRegularFile(doc)) {
                sendDetail(ex, 500, "markdown file was not generated");
                return;
            }
            byte[] body = Files.readAllBytes(doc);
            ex.getResponseHeaders().set("Content-Type", "text/markdown; charset=utf-8");
            ex.getResponseHeaders().set("Content-Disposition", contentDisposition(config.getOutputFilename()));
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(body);
            }
        } catch (RuntimeException e) {
            log.error("Download request failed: {}", e.toString(), e);
            sendDetail(ex, 500, e.toString());
        } finally {
            ex.close();
        }
    }

    CrawlConfig toCrawlConfig(DownloadRequest req) {
        if (req == null) throw new IllegalArgumentException("request body is required");
        if (req.url() == null || req.url().isBlank()) throw new IllegalArgumentException("url is required");
        if (req.config() == null) throw new IllegalArgumentException("config is required");

        // 요청 config 에서는 선택자/사전 제거만 받는다. 출력 위치와 지연은 서버 설정 고정
        CrawlConfig.Builder b = CrawlConfig.builder()
                .outputRoot(outputRoot)
                .requestDelay(requestDelay);
        CrawlConfigLoader.applySelectors(req.config(), b);

        // 최상위 사전 제거 필드가 config 안의 값보다 우선
        String preType = firstNonBlank(req.preRemoveType(), asString(req.config().get("pre_remove_type")));
        String preValue = firstNonBlank(req.preRemoveValue(), asString(req.config().get("pre_remove_value")));
        b.preRemove(preType, preValue);

        String filename = firstNonBlank(req.filename(), DEFAULT_FILENAME);
        if (filename.contains("/") || filename.contains("\\") || filename.equals("..") || filename.equals(".")) {
            throw new IllegalArgumentException("filename must be a plain file name: " + filename);
        }
        return b.outputFilename(filename)
                .baseUrl(req.url())
                .build();
    }

    static String contentDisposition(String filename) {
        String quoted = URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20");
        return "attachment; filename*=UTF-8''" + quoted;
    }

    private void sendDetail(HttpExchange ex, int status, String detail) throws IOException {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("detail", detail);
        byte[] body = OM.writeValueAsBytes(payload);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(status, body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
        if (status >= 500) log.error("Download request -> {}: {}", status, detail);
    }

    private static String asString(Object o) {
        return (o == null) ? null : String.valueOf(o);
    }

    private static String firstNonBlank(String a, String b) {
        return (a != null && !a.isBlank()) ? a : b;
    }
}
