package com.webtomd.core.service.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** 가져온 원본 HTML 보관(ori_html). 쓰기 실패는 경고만 남기고 크롤은 계속. */
public class HtmlCache {
    private final Path outputRoot;
    private final String baseUrl;
    private final Logger log;

    public HtmlCache(Path outputRoot, String baseUrl) {
        this(outputRoot, baseUrl, LoggerFactory.getLogger(HtmlCache.class));
    }

    public HtmlCache(Path outputRoot, String baseUrl, Logger log) {
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.log = Objects.requireNonNull(log, "log");
    }

    public Path pathFor(String pageUrl) {
        return OutputNaming.htmlCachePath(outputRoot, baseUrl, pageUrl);
    }

    /** 저장된 경로, 실패하면 empty */
    public Optional<Path> save(String pageUrl, String html) {
        Path file = pathFor(pageUrl);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, html == null ? "" : html, StandardCharsets.UTF_8);
            log.info("HTML saved: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("HTML cache write failed {}: {}", file, e.toString());
            return Optional.empty();
        }
    }
}
