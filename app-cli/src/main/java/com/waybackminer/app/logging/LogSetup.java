package com.waybackminer.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J 는 slf4j-jdk14 로 여기에 연결된다).
 * 콘솔은 stderr 로만 찍는다. stdout 은 결과 URL 전용이다.
 * System props:
 *  -Dwm.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING)
 *  -Dwm.log.dir=logs   설정 시 파일 롤링(app-%g.log)
 *  -Dwm.log.sizeMb=2
 *  -Dwm.log.files=5
 *  -Dwm.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wm.log.level", "WARNING"));
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wm.log.console", "true"));
        String dir = System.getProperty("wm.log.dir");

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler(); // System.err
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (dir != null && !dir.isBlank()) {
            Path logDir = Path.of(dir.trim());
            int sizeMb = parseInt(System.getProperty("wm.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("wm.log.files"), 5);
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("app-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 계속
                Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. level=" + level.getName() + (dir != null ? ", dir=" + dir : ""));
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
