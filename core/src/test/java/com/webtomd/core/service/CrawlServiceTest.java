package com.webtomd.core.service;

import com.webtomd.core.convert.ContentConverter;
import com.webtomd.core.convert.FlexmarkMarkdownConverter;
import com.webtomd.core.convert.RegexLinkRewriter;
import com.webtomd.core.crawler.JsoupLinkExtractor;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.CrawlReport;
import com.webtomd.core.model.PageFailure;
import com.webtomd.core.model.SelectorType;
import com.webtomd.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.lang.reflect.Proxy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CrawlServiceTest {

    private static final String BASE = "https://ex.com/";
    private static final String PAGE_A = "https://ex.com/a";
    private static final String PAGE_B = "https://ex.com/b";

    private static final String NAV =
            "<div class=\"nav\"><a href=\"/a\">A</a> <a href=\"/b#part\">B</a> <a href=\"#top\">top</a></div>";

    private static final String ENTRY_HTML =
            "<html><head><title>Home</title></head><body>" + NAV + "<p>Welcome home</p></body></html>";
    private static final String A_HTML =
            "<html><head><title>Page One</title></head><body>" + NAV
            + "<div class=\"ads\">BUY NOW</div>"
            + "<h2>One</h2><p>First page body</p></body></html>";
    private static final String B_HTML =
            "<html><head><title>Page Two</title></head><body>" + NAV
            + "<p>Back to <a href=\"https://ex.com/a\">the first page</a>.</p></body></html>";

    @TempDir Path tmp;

    private CrawlConfig.Builder config() {
        return CrawlConfig.builder()
                .baseUrl(BASE)
                .selector(SelectorType.CLASS, "nav")
                .outputFilename("out.md")
                .outputRoot(tmp);
    }

    private static FakeFetcher site() {
        return new FakeFetcher().page(BASE, ENTRY_HTML).page(PAGE_A, A_HTML).page(PAGE_B, B_HTML);
    }

    private static CrawlService service(CrawlConfig cfg, FakeFetcher fetcher) {
        return new CrawlService(cfg, fetcher, NOPLogger.NOP_LOGGER);
    }

    private String section(String doc, String title, String nextTitle) {
        int from = doc.indexOf("\n# " + title + "\n");
        int to = (nextTitle == null) ? doc.length() : doc.indexOf("\n# " + nextTitle + "\n");
        assertThat(from).as("section " + title).isNotNegative();
        return doc.substring(from, to);
    }

    @Test
    void writesOneDocumentWithTocAndSections() throws Exception {
        FakeFetcher fetcher = site();
        CrawlService svc = service(config().build(), fetcher);

        CrawlReport report = svc.run();

        assertThat(svc.getState()).isEqualTo(CrawlState.DONE);
        assertThat(report.document()).isEqualTo(tmp.resolve("ex.com").resolve("out.md").toAbsolutePath());
        assertThat(report.pages()).containsExactly(BASE, PAGE_A, PAGE_B);
        assertThat(report.failures()).isEmpty();
        // 진입 페이지는 한 번만 요청
        assertThat(fetcher.calls).containsExactly(BASE, PAGE_A, PAGE_B);

        String doc = Files.readString(report.document());
        assertThat(doc).startsWith("> **Main link: [https://ex.com/](https://ex.com/)**\n\n# Contents\n\n");
        assertThat(doc).contains("- [Home](#home)\n- [Page One](#pageone)\n- [Page Two](#pagetwo)\n\n---\n\n");
        assertThat(doc.indexOf("# Home")).isLessThan(doc.indexOf("# Page One"));
        assertThat(doc.indexOf("# Page One")).isLessThan(doc.indexOf("# Page Two"));
        assertThat(doc).endsWith("\n\n---\n\n");
    }

    @Test
    @DisplayName("진입 페이지가 아닌 페이지는 내비게이션 제거, 진입 페이지는 그대로")
    void navigationIsRemovedFromNonEntryPagesOnly() throws Exception {
        String doc = Files.readString(service(config().build(), site()).run().document());

        assertThat(section(doc, "Home", "Page One")).contains("[A](").contains("Welcome home");
        assertThat(section(doc, "Page One", "Page Two")).doesNotContain("[A](").contains("First page body");
    }

    @Test
    @DisplayName("2페이지의 1페이지 링크 → #slug")
    void backLinkToCrawledPageBecomesAnchor() throws Exception {
        String doc = Files.readString(service(config().build(), site()).run().document());

        assertThat(section(doc, "Page Two", null)).contains("[the first page](#pageone)");
    }

    @Test
    @DisplayName("가져오기 실패 페이지는 목차/본문에서 빠짐")
    void failedPageIsOmitted() throws Exception {
        FakeFetcher fetcher = site().fail(PAGE_B, "timeout after 30000 ms");

        CrawlReport report = service(config().build(), fetcher).run();

        String doc = Files.readString(report.document());
        assertThat(doc).doesNotContain("Page Two");
        assertThat(report.pages()).containsExactly(BASE, PAGE_A);
        assertThat(report.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.url()).isEqualTo(PAGE_B);
                    assertThat(f.kind()).isEqualTo(PageFailure.Kind.FETCH);
                    assertThat(f.reason()).contains("timeout");
                });
    }

    @Test
    @DisplayName("컨테이너 없음 → NoContainerException, 파일 없음")
    void noContainerAbortsWithoutOutput() {
        CrawlService svc = service(config().selector(SelectorType.ID, "missing").build(), site());

        assertThatThrownBy(svc::run)
                .isInstanceOf(NoContainerException.class)
                .extracting(e -> ((CrawlException) e).getStage())
                .isEqualTo(CrawlState.LOCATE_CONTAINER);
        assertThat(svc.getState()).isEqualTo(CrawlState.FAILED);
        assertThat(tmp.resolve("ex.com")).doesNotExist();
    }

    @Test
    void noUsableLinksAborts() {
        FakeFetcher fetcher = new FakeFetcher().page(BASE,
                "<html><body><div class=\"nav\"><a href=\"#top\">top</a><a href=\"javascript:x()\">js</a></div></body></html>");
        CrawlService svc = service(config().build(), fetcher);

        assertThatThrownBy(svc::run).isInstanceOf(NoLinksException.class);
        assertThat(svc.getState()).isEqualTo(CrawlState.FAILED);
        assertThat(tmp.resolve("ex.com")).doesNotExist();
    }

    @Test
    void entryPageFailureAborts() {
        FakeFetcher fetcher = new FakeFetcher().fail(BASE, "connection refused");
        CrawlService svc = service(config().build(), fetcher);

        assertThatThrownBy(svc::run)
                .isInstanceOf(EntryPageUnavailableException.class)
                .hasMessageContaining("cannot retrieve entry page")
                .hasMessageContaining("connection refused");
        assertThat(fetcher.calls).containsExactly(BASE);
    }

    @Test
    void preRemovalAppliesToDocumentButCacheKeepsRawHtml() throws Exception {
        CrawlConfig cfg = config().preRemove(SelectorType.CLASS, "ads").build();

        String doc = Files.readString(service(cfg, site()).run().document());

        assertThat(doc).doesNotContain("BUY NOW");
        Path cached = tmp.resolve("ori_html").resolve("ex.com").resolve("a.html");
        assertThat(Files.readString(cached)).contains("BUY NOW");
        assertThat(tmp.resolve("ori_html").resolve("ex.com").resolve("index.html")).exists();
    }

    @Test
    void delayIsAppliedBetweenPageFetches() throws Exception {
        List<Duration> sleeps = new ArrayList<>();
        Sleeper recording = sleeps::add;
        CrawlConfig cfg = config().requestDelay(Duration.ofMillis(250)).build();
        CrawlService svc = new CrawlService(cfg, site(), new JsoupLinkExtractor(),
                new ContentConverter(new FlexmarkMarkdownConverter(), NOPLogger.NOP_LOGGER),
                new RegexLinkRewriter(), recording, NOPLogger.NOP_LOGGER);

        svc.run();

        assertThat(sleeps).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
    }

    @Test
    void conversionFailureIsDegradedNotFatal() throws Exception {
        CrawlService svc = new CrawlService(config().build(), site(), new JsoupLinkExtractor(),
                new ContentConverter(html -> { throw new IllegalStateException("boom"); }, NOPLogger.NOP_LOGGER),
                new RegexLinkRewriter(), Sleeper.NONE, NOPLogger.NOP_LOGGER);

        CrawlReport report = svc.run();

        assertThat(Files.readString(report.document())).contains("Conversion failed: boom");
        assertThat(report.failures()).hasSize(3)
                .allMatch(f -> f.kind() == PageFailure.Kind.CONVERSION);
    }

    @Test
    void persistFailureRaisesPersistException() throws Exception {
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        CrawlService svc = service(config().outputRoot(blocker).build(), site());

        assertThatThrownBy(svc::run)
                .isInstanceOf(PersistException.class)
                .extracting(e -> ((CrawlException) e).getStage())
                .isEqualTo(CrawlState.PERSIST);
        assertThat(svc.getState()).isEqualTo(CrawlState.FAILED);
    }

    @Test
    void reportsProgressPhasesAndIsSingleUse() throws Exception {
        Set<String> phases = new LinkedHashSet<>();
        CrawlService svc = service(config().build(), site())
                .withProgressListener((p, phase, done, total) -> phases.add(phase));

        svc.run();

        assertThat(phases).containsExactly("fetch", "convert", "assemble", "persist");
        assertThatThrownBy(svc::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void titleFallsBackToUrlPath() {
        assertThat(CrawlService.titleOf("<p>no title</p>", "https://ex.com/docs/")).isEqualTo("/docs/index");
        assertThat(CrawlService.titleOf("<title>  Spaced  </title>", "https://ex.com/x")).isEqualTo("Spaced");
    }

    @Test
    @DisplayName("기본 생성자도 주입된 Logger를 변환기까지 넘긴다")
    void injectedLoggerReachesConverter() throws Exception {
        List<String> messages = new ArrayList<>();
        Logger recording = (Logger) Proxy.newProxyInstance(Logger.class.getClassLoader(), new Class<?>[]{Logger.class},
                (proxy, method, args) -> {
                    if (method.getReturnType() == boolean.class) return true;
                    if (method.getReturnType() == int.class) return 0;
                    if (args != null && args.length > 0 && args[0] instanceof String msg) messages.add(method.getName() + ":" + msg);
                    return null;
                });

        new CrawlService(config().build(), site(), recording).run();

        assertThat(messages).anyMatch(m -> m.startsWith("debug:Converted "));
    }
}
