package com.webtomd.app.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    private final Logger app = Logger.getLogger(LogSetup.APP_LOGGER);
    private final Logger root = Logger.getLogger("");
    private Level appBefore;
    private Level rootBefore;

    @BeforeEach
    void remember() {
        appBefore = app.getLevel();
        rootBefore = root.getLevel();
    }

    @AfterEach
    void restore() {
        app.setLevel(appBefore);
        root.setLevel(rootBefore);
    }

    @Test
    @DisplayName("--verbose 는 앱 로거만 FINE, 루트 레벨은 유지")
    void verboseRaisesOnlyAppLoggers() {
        root.setLevel(Level.INFO);

        LogSetup.verbose();

        assertThat(app.getLevel()).isEqualTo(Level.FINE);
        assertThat(Logger.getLogger("com.webtomd.core.service.CrawlService").isLoggable(Level.FINE)).isTrue();
        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(Logger.getLogger("jdk.internal.httpclient.debug").isLoggable(Level.FINE)).isFalse();
    }

    @Test
    void levelOfFallsBackToInfo() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" warning ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void fileLineCarriesLoggerNameAndStack() {
        LogRecord r = new LogRecord(Level.WARNING, "Page fetch failed, skipped: {0}");
        r.setParameters(new Object[]{"https://ex.com/a"});
        r.setLoggerName("com.webtomd.core.service.CrawlService");
        r.setThrown(new IllegalStateException("boom"));

        String line = new LogSetup.LineFormatter().format(r);

        assertThat(line).contains("[WARNING]")
                .contains("com.webtomd.core.service.CrawlService - Page fetch failed, skipped: https://ex.com/a")
                .contains("java.lang.IllegalStateException: boom")
                .contains("at ");
    }

    @Test
    void consoleLineIsShortAndSummarizesCause() {
        app.setLevel(Level.INFO);
        LogRecord r = new LogRecord(Level.SEVERE, "Crawl aborted");
        r.setLoggerName("com.webtomd.core.service.CrawlService");
        r.setThrown(new IllegalStateException("boom"));

        String line = new LogSetup.ConsoleFormatter().format(r);

        assertThat(line).startsWith("SEVERE  Crawl aborted")
                .contains("caused by java.lang.IllegalStateException: boom")
                .doesNotContain("CrawlService")
                .doesNotContain("\tat ");
    }
}
