package com.webtomd.app;

import com.webtomd.app.logging.LogSetup;
import com.webtomd.app.server.DownloadServer;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.CrawlReport;
import com.webtomd.core.model.PageFailure;
import com.webtomd.core.service.CrawlException;
import com.webtomd.core.service.CrawlService;
import com.webtomd.core.util.ProgressListener;

import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 명령행 진입점.
 * - webtomd &lt;url&gt; ...: 크롤 1회 후 종료(0 성공, 1 실패/중단, 2 사용법 오류)
 * - webtomd serve: POST /download/ 서버 기동
 */
public final class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    // 크롤 진행 중 Ctrl+C → 종료 코드 1
    private static volatile boolean crawling = false;

    private Main() {}

    public static void main(String[] args) {
        LogSetup.init(Path.of(System.getProperty("wtm.log.dir", "logs")));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (crawling) {
                System.err.println();
                System.err.println("Download interrupted by user");
                Runtime.getRuntime().halt(EXIT_ERROR);
            }
        }, "webtomd-interrupt"));
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (CliOptions.UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.usage());
            return EXIT_USAGE;
        }

        if (opts.getCommand() == CliOptions.Command.HELP) {
            out.println(CliOptions.usage());
            return EXIT_OK;
        }
        if (opts.isVerbose()) LogSetup.verbose();
        if (opts.getCommand() == CliOptions.Command.SERVE) {
            return serve(opts, out, err);
        }

        CrawlConfig config;
        try {
            config = opts.toCrawlConfig();
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return EXIT_ERROR;
        }

        out.println("Pre-removal: " + (config.isPreRemovalEnabled()
                ? "type=" + config.getPreRemoveType().key() + ", value=" + config.getPreRemoveValue()
                : "none"));
        out.println("Starting download...");
        out.println("URL: " + config.getBaseUrl());
        out.println("Selector: " + config.getSelectorType().key() + "=" + config.getSelectorValue());
        out.println("Output file: " + config.getOutputFilename());
        out.println("-".repeat(50));

        crawling = true;
        try {
            CrawlReport report = new CrawlService(config)
                    .withProgressListener(consoleProgress(out))
                    .run();
            out.println();
            out.println("Download complete! Saved to: " + report.document());
            out.println("Pages: " + report.pages().size());
            for (PageFailure f : report.failures()) {
                out.println("  skipped/degraded [" + f.kind() + "] " + f.url() + " (" + f.reason() + ")");
            }
            return EXIT_OK;
        } catch (CrawlException e) {
            err.println("Download failed: " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            err.println("Unexpected error during download: " + e);
            return EXIT_ERROR;
        } finally {
            crawling = false;
        }
    }

    private static int serve(CliOptions opts, PrintStream out, PrintStream err) {
        DownloadServer server;
        try {
            server = new DownloadServer(new InetSocketAddress(opts.getPort()), opts.outputRoot(), opts.requestDelay());
        } catch (IOException e) {
            err.println("Cannot start server on port " + opts.getPort() + ": " + e.getMessage());
            return EXIT_ERROR;
        }
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "webtomd-server-stop"));
        out.println("Listening on http://localhost:" + server.port() + DownloadServer.PATH);
        try {
            Thread.currentThread().join(); // 종료 신호까지 대기
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    private static ProgressListener consoleProgress(PrintStream out) {
        return (p, phase, done, total) -> {
            if (ProgressListener.isPerPage(phase)) {
                out.printf(Locale.ROOT, "[%s] %d/%d (%.0f%%)%n", phase, done, total, p * 100);
            }
        };
    }
}
