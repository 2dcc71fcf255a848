package com.webtomd.core.service;

import com.webtomd.core.api.ILinkRewriter;
import com.webtomd.core.api.IPageFetcher;
import com.webtomd.core.convert.ContentConverter;
import com.webtomd.core.convert.ConversionResult;
import com.webtomd.core.convert.FlexmarkMarkdownConverter;
import com.webtomd.core.convert.RegexLinkRewriter;
import com.webtomd.core.crawler.ElementLocator;
import com.webtomd.core.crawler.JsoupLinkExtractor;
import com.webtomd.core.crawler.LinkExtractor;
import com.webtomd.core.crawler.NavigationRemovalStep;
import com.webtomd.core.crawler.PreRemovalStep;
import com.webtomd.core.http.PageFetcher;
import com.webtomd.core.model.AssembledDocument;
import com.webtomd.core.model.AssembledDocument.Section;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.CrawlReport;
import com.webtomd.core.model.FetchResult;
import com.webtomd.core.model.PageFailure;
import com.webtomd.core.model.PageRecord;
import com.webtomd.core.model.PageTable;
import com.webtomd.core.service.export.DocumentAssembler;
import com.webtomd.core.service.export.HtmlCache;
import com.webtomd.core.service.export.MarkdownDocumentWriter;
import com.webtomd.core.service.export.OutputNaming;
import com.webtomd.core.util.AnchorSlugs;
import com.webtomd.core.util.ProgressListener;
import com.webtomd.core.util.Sleeper;
import com.webtomd.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 오케스트레이터(1회용):
 *  - 진입 페이지 → 링크 컨테이너 → 링크 추출 → 전체 가져오기 → 변환 → 조립 → 저장
 *  - 앞의 세 단계와 저장 실패는 CrawlException, 페이지 단위 실패는 리포트에 기록하고 계속
 *  - 요청은 순차, 요청 사이에 설정된 지연
 */
public final class CrawlService {

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final ContentConverter converter;
    private final ILinkRewriter rewriter;
    private final DocumentAssembler assembler = new DocumentAssembler();
    private final MarkdownDocumentWriter writer;
    private final HtmlCache htmlCache;
    private final PreRemovalStep preRemoval;
    private final NavigationRemovalStep navigationRemoval;
    private final Sleeper sleeper;
    private final Logger log;

    private volatile CrawlState state = CrawlState.IDLE;
    private ProgressListener listener = ProgressListener.NONE;

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config, new PageFetcher(config), LoggerFactory.getLogger(CrawlService.class));
    }

    public CrawlService(CrawlConfig config, IPageFetcher fetcher, Logger log) {
        this(config, fetcher, new JsoupLinkExtractor(), new ContentConverter(new FlexmarkMarkdownConverter(), log),
                new RegexLinkRewriter(), Sleeper.SYSTEM, log);
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config,
                        IPageFetcher fetcher,
                        LinkExtractor extractor,
                        ContentConverter converter,
                        ILinkRewriter rewriter,
                        Sleeper sleeper,
                        Logger log) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.log = Objects.requireNonNull(log, "log");
        this.writer = new MarkdownDocumentWriter(log);
        this.htmlCache = new HtmlCache(config.getOutputRoot(), config.getBaseUrl(), log);
        this.preRemoval = PreRemovalStep.from(config);
        this.navigationRemoval = new NavigationRemovalStep(config.getSelectorType(), config.getSelectorValue());
    }

    public CrawlService withProgressListener(ProgressListener l) {
        this.listener = (l == null) ? ProgressListener.NONE : l;
        return this;
    }

    public CrawlState getState() { return state; }

    public CrawlReport run() throws CrawlException {
        if (state != CrawlState.IDLE) {
            throw new IllegalStateException("CrawlService is single-use (state=" + state + ")");
        }
        String baseUrl = config.getBaseUrl();
        log.info("Crawl start: base={} selector={}={} preRemove={}",
                baseUrl, config.getSelectorType().key(), config.getSelectorValue(),
                config.isPreRemovalEnabled() ? config.getPreRemoveType().key() + "=" + config.getPreRemoveValue() : "off");

        try {
            // 1) 진입 페이지
            enter(CrawlState.FETCH_ENTRY);
            FetchResult entry = fetcher.fetch(baseUrl);
            if (!entry.isOk()) {
                throw new EntryPageUnavailableException(baseUrl, entry.failureReason());
            }

            // 2) 링크 컨테이너(사전 제거 전 원본 기준)
            enter(CrawlState.LOCATE_CONTAINER);
            List<Element> containers = ElementLocator.locate(
                    Jsoup.parse(entry.getBody(), baseUrl), config.getSelectorType(), config.getSelectorValue());
            if (containers.isEmpty()) {
                throw new NoContainerException(config.getSelectorType(), config.getSelectorValue());
            }
            log.info("Found {} link container(s)", containers.size());

            // 3) 링크 추출
            enter(CrawlState.EXTRACT_LINKS);
            List<String> links = extractor.extract(containers, baseUrl);
            if (links.isEmpty()) {
                throw new NoLinksException(containers.size());
            }
            log.info("Discovered {} link(s)", links.size());

            // 4) 전체 가져오기
            enter(CrawlState.FETCH_ALL);
            List<PageFailure> failures = new ArrayList<>();
            String entryUrl = UrlUtils.stripFragment(baseUrl);
            PageTable pages = fetchAll(entryUrl, entry, links, failures);

            // 5) 변환
            enter(CrawlState.CONVERT);
            List<Section> sections = convertAll(entryUrl, pages, failures);

            // 6) 조립
            enter(CrawlState.ASSEMBLE);
            listener.onProgress(0.0, ProgressListener.ASSEMBLE, 0, 1);
            AssembledDocument doc = assembler.assemble(baseUrl, sections);
            listener.onProgress(1.0, ProgressListener.ASSEMBLE, 1, 1);

            // 7) 저장
            enter(CrawlState.PERSIST);
            listener.onProgress(0.0, ProgressListener.PERSIST, 0, 1);
            Path target = OutputNaming.documentPath(config.getOutputRoot(), baseUrl, config.getOutputFilename());
            Path written;
            try {
                written = writer.write(target, doc.render());
            } catch (IOException e) {
                throw new PersistException(target, e);
            }
            listener.onProgress(1.0, ProgressListener.PERSIST, 1, 1);

            enter(CrawlState.DONE);
            log.info("Crawl done: {} page(s), {} failure(s) -> {}", pages.size(), failures.size(), written);
            return new CrawlReport(written, pages.urls(), failures);
        } catch (CrawlException e) {
            state = CrawlState.FAILED;
            log.error("Crawl failed at {}: {}", e.getStage(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            state = CrawlState.FAILED;
            log.error("Crawl aborted: {}", e.toString(), e);
            throw e;
        }
    }

    private void enter(CrawlState next) {
        log.debug("State {} -> {}", state, next);
        state = next;
    }

    private PageTable fetchAll(String entryUrl, FetchResult entry, List<String> links,
                               List<PageFailure> failures) throws CrawlException {
        List<String> candidates = new ArrayList<>();
        candidates.add(entryUrl);
        for (String l : links) candidates.add(UrlUtils.stripFragment(l));
        candidates = UrlUtils.distinctInOrder(candidates);

        PageTable pages = new PageTable();
        int total = candidates.size();
        Duration delay = config.getRequestDelay();
        for (int i = 0; i < total; i++) {
            String url = candidates.get(i);
            FetchResult res;
            if (url.equals(entryUrl)) {
                res = entry; // 이미 받은 진입 페이지 재사용
            } else {
                pause(delay);
                res = fetcher.fetch(url);
            }

            if (!res.isOk()) {
                log.warn("Page fetch failed, skipped: {} ({})", url, res.failureReason());
                failures.add(new PageFailure(url, PageFailure.Kind.FETCH, res.failureReason()));
            } else {
                String raw = res.getBody();
                htmlCache.save(url, raw);
                String title = titleOf(raw, url);
                pages.add(new PageRecord(url, preRemoval.apply(raw), title, AnchorSlugs.slugOf(title)));
            }
            listener.onProgress((i + 1) / (double) total, ProgressListener.FETCH, i + 1, total);
        }
        log.info("Fetched {}/{} page(s)", pages.size(), total);
        return pages;
    }

    private List<Section> convertAll(String entryUrl, PageTable pages, List<PageFailure> failures) {
        List<PageRecord> records = pages.records();
        List<Section> sections = new ArrayList<>(records.size());
        int total = records.size();
        for (int i = 0; i < total; i++) {
            PageRecord page = records.get(i);
            String html = page.url().equals(entryUrl) ? page.html() : navigationRemoval.apply(page.html());
            ConversionResult r = converter.convert(html);
            if (r.degraded()) {
                failures.add(new PageFailure(page.url(), PageFailure.Kind.CONVERSION, r.error()));
            }
            String body = rewriter.rewriteLinks(r.markdown(), pages, page.url());
            sections.add(new Section(page.title(), page.anchorSlug(), body));
            listener.onProgress((i + 1) / (double) total, ProgressListener.CONVERT, i + 1, total);
        }
        return sections;
    }

    private void pause(Duration delay) throws CrawlException {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException(CrawlState.FETCH_ALL, "crawl interrupted", e);
        }
    }

    /** &lt;title&gt; 텍스트, 없으면 URL 경로 기반 키 */
    static String titleOf(String html, String url) {
        String t = Jsoup.parse(html == null ? "" : html).title();
        if (t != null && !t.isBlank()) return t.trim();
        return OutputNaming.pageKey(url);
    }
}
