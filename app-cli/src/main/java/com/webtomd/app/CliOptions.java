package com.webtomd.app;

import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.SelectorType;
import com.webtomd.core.util.CrawlConfigLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * 명령행 인자.
 *   webtomd &lt;url&gt; [--type class|id|tag] [--value V] [--config FILE] [--filename F]
 *           [--delay SECONDS] [--pre-remove-type T] [--pre-remove-value V] [--output-dir DIR] [--verbose]
 *   webtomd serve [--port N] [--output-dir DIR] [--delay SECONDS] [--verbose]
 *
 * 파일명 우선순위: 설정 파일 filename &gt; --filename &gt; tutorial.md
 */
public final class CliOptions {

    public enum Command { DOWNLOAD, SERVE, HELP }

    public static final String DEFAULT_FILENAME = "tutorial.md";
    public static final double DEFAULT_DELAY_SECONDS = 1.0;
    public static final int DEFAULT_PORT = 8000;

    /** 잘못된 인자(종료 코드 2) */
    public static final class UsageException extends Exception {
        public UsageException(String message) { super(message); }
    }

    private Command command = Command.DOWNLOAD;
    private String url;
    private SelectorType type = SelectorType.CLASS;
    private String value;
    private Path configFile;
    private String filename;
    private double delaySeconds = DEFAULT_DELAY_SECONDS;
    private SelectorType preRemoveType;
    private String preRemoveValue;
    private Path outputDir;
    private int port = DEFAULT_PORT;
    private boolean verbose;

    private CliOptions() {}

    public Command getCommand() { return command; }
    public String getUrl() { return url; }
    public SelectorType getType() { return type; }
    public String getValue() { return value; }
    public Path getConfigFile() { return configFile; }
    public String getFilename() { return filename; }
    public double getDelaySeconds() { return delaySeconds; }
    public SelectorType getPreRemoveType() { return preRemoveType; }
    public String getPreRemoveValue() { return preRemoveValue; }
    public Path getOutputDir() { return outputDir; }
    public int getPort() { return port; }
    public boolean isVerbose() { return verbose; }

    public Duration requestDelay() { return Duration.ofMillis(Math.round(delaySeconds * 1000)); }
    public Path outputRoot() { return (outputDir != null) ? outputDir : CrawlConfig.DEFAULT_OUTPUT_ROOT; }

    public static CliOptions parse(String[] args) throws UsageException {
        CliOptions o = new CliOptions();
        if (args == null || args.length == 0) throw new UsageException("missing <url>");

        int i = 0;
        if ("serve".equals(args[0])) {
            o.command = Command.SERVE;
            i = 1;
        }
        for (; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h":
                case "--help":
                    o.command = Command.HELP;
                    return o;
                case "--verbose":
                    o.verbose = true;
                    break;
                case "--type":
                    o.type = selectorType(a, next(args, ++i, a));
                    break;
                case "--value":
                    o.value = next(args, ++i, a);
                    break;
                case "--config":
                    o.configFile = Path.of(next(args, ++i, a));
                    break;
                case "--filename":
                    o.filename = next(args, ++i, a);
                    break;
                case "--delay":
                    o.delaySeconds = parseDelay(next(args, ++i, a));
                    break;
                case "--pre-remove-type":
                    o.preRemoveType = selectorType(a, next(args, ++i, a));
                    break;
                case "--pre-remove-value":
                    o.preRemoveValue = next(args, ++i, a);
                    break;
                case "--output-dir":
                    o.outputDir = Path.of(next(args, ++i, a));
                    break;
                case "--port":
                    o.port = parsePort(next(args, ++i, a));
                    break;
                default:
                    if (a.startsWith("-")) throw new UsageException("unknown option: " + a);
                    if (o.command == Command.SERVE) throw new UsageException("serve takes no positional argument: " + a);
                    if (o.url != null) throw new UsageException("unexpected argument: " + a);
                    o.url = a;
            }
        }

        if (o.command == Command.DOWNLOAD) {
            if (o.url == null) throw new UsageException("missing <url>");
            if (o.configFile == null && (o.value == null || o.value.isBlank())) {
                throw new UsageException("--value is required unless --config is given");
            }
        }
        return o;
    }

    /**
     * 설정 파일이 있으면 그 내용(type/value/filename/사전 제거...)이 명령행 값보다 우선한다.
     * url은 항상 명령행 값.
     */
    public CrawlConfig toCrawlConfig() throws IOException {
        CrawlConfig.Builder b = CrawlConfig.builder()
                .outputFilename(filename != null ? filename : DEFAULT_FILENAME)
                .outputRoot(outputRoot())
                .requestDelay(requestDelay());

        if (configFile != null) {
            CrawlConfigLoader.applyTo(configFile, b);
        } else {
            b.selector(type, value);
            // 둘 다 있어야 사전 제거
            if (preRemoveType != null && preRemoveValue != null && !preRemoveValue.isBlank()) {
                b.preRemove(preRemoveType, preRemoveValue);
            }
        }
        return b.baseUrl(url).build();
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage:",
                "  webtomd <url> [--type class|id|tag] [--value V] [--config FILE] [--filename F]",
                "          [--delay SECONDS] [--pre-remove-type T] [--pre-remove-value V]",
                "          [--output-dir DIR] [--verbose]",
                "  webtomd serve [--port N] [--output-dir DIR] [--delay SECONDS] [--verbose]",
                "",
                "Examples:",
                "  webtomd https://example.com/tutorial --type class --value urlList",
                "  webtomd https://example.com/tutorial --config config.json",
                "  webtomd https://example.com/tutorial --type id --value main-content --filename my_tutorial.md",
                "",
                "A filename in the config file wins over --filename; the default is " + DEFAULT_FILENAME + ".",
                "--pre-remove-value accepts several values separated by '|'.");
    }

    // ------------ helpers ------------
    private static String next(String[] args, int i, String option) throws UsageException {
        if (i >= args.length) throw new UsageException(option + " requires a value");
        return args[i];
    }

    private static SelectorType selectorType(String option, String s) throws UsageException {
        try {
            return SelectorType.parse(s);
        } catch (IllegalArgumentException e) {
            throw new UsageException(option + " must be one of class, id, tag: " + s);
        }
    }

    private static double parseDelay(String s) throws UsageException {
        try {
            double d = Double.parseDouble(s.trim());
            if (d < 0 || Double.isNaN(d) || Double.isInfinite(d)) throw new NumberFormatException();
            return d;
        } catch (NumberFormatException e) {
            throw new UsageException("--delay must be a non-negative number of seconds: " + s);
        }
    }

    private static int parsePort(String s) throws UsageException {
        try {
            int p = Integer.parseInt(s.trim());
            if (p < 0 || p > 65535) throw new NumberFormatException();
            return p;
        } catch (NumberFormatException e) {
            throw new UsageException("--port must be 0-65535: " + s);
        }
    }

    @Override public String toString() {
        return String.format(Locale.ROOT, "CliOptions{command=%s, url=%s, type=%s, value=%s, config=%s, filename=%s}",
                command, url, type.key(), value, configFile, filename);
    }
}
