package com.webtomd.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.*;
import java.util.Locale;
import java.util.logging.*;

/**
 * CLI용 java.util.logging 설정. slf4j는 slf4j-jdk14로 여기에 붙는다.
 * - 콘솔(stderr): "LEVEL 메시지" 짧은 형식. stdout은 진행 표시 전용
 * - 파일: logDir/webtomd-%g.log, 사이즈 롤링(기본 2MB x 5), 시각/스레드/로거 포함
 * - verbose(): com.webtomd 로거만 FINE. JDK HttpClient 등 라이브러리 로그는 기존 레벨 유지
 */
public final class LogSetup {
    private LogSetup() {}

    public static final String APP_LOGGER = "com.webtomd";

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter FILE_FORMATTER = new LineFormatter();
    private static final Formatter CONSOLE_FORMATTER = new ConsoleFormatter();

    // JUL 로거는 약한 참조라 레벨을 바꾼 인스턴스를 붙잡아 둔다
    private static final Logger APP = Logger.getLogger(APP_LOGGER);

    /** System props:
     *  -Dwtm.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
     *  -Dwtm.log.sizeMb=2
     *  -Dwtm.log.files=5
     *  -Dwtm.log.console=true|false (기본 true)
     */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wtm.log.level", "INFO"));
        int sizeMb   = parseInt(System.getProperty("wtm.log.sizeMb"), 2);
        int fileCnt  = parseInt(System.getProperty("wtm.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wtm.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(CONSOLE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("webtomd-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(FILE_FORMATTER);
            root.addHandler(file);
            APP.log(Level.CONFIG, () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 실패: 콘솔만으로 진행
            root.log(Level.WARNING, "Log file setup failed, console only: " + e.getMessage(), e);
        }
    }

    /** --verbose: 앱 로거와 핸들러를 FINE으로. 루트(라이브러리) 레벨은 그대로 */
    public static void verbose() {
        APP.setLevel(Level.FINE);
        for (Handler h : Logger.getLogger("").getHandlers()) {
            if (h.getLevel().intValue() > Level.FINE.intValue()) h.setLevel(Level.FINE);
        }
        APP.fine("Verbose logging enabled");
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    private static String stackOf(Throwable t) {
        StringWriter sw = new StringWriter(256);
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /** 파일용 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            return (t == null) ? base : base + stackOf(t) + System.lineSeparator();
        }
    }

    /** 콘솔용: 레벨 + 메시지. 스택은 FINE 이하일 때만(파일에는 항상 남음) */
    static final class ConsoleFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT, "%-7s %s%n", r.getLevel().getName(), formatMessage(r));
            Throwable t = r.getThrown();
            if (t == null) return base;
            if (APP.isLoggable(Level.FINE)) return base + stackOf(t);
            return base + "        caused by " + t + System.lineSeparator();
        }
    }
}
