package com.compliancegate.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J 는 slf4j-jdk14 로 여기에 합류).
 * 콘솔 핸들러는 stderr 로만 쓴다. stdout 은 보고서 본문 전용.
 *
 * System props:
 *  -Dcg.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dcg.log.dir=logs      설정 시 롤링 파일 추가 (gate-%g.log)
 *  -Dcg.log.sizeMb=2
 *  -Dcg.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("cg.log.level", "INFO"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler(); // System.err
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("cg.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir.trim()), level);
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).fine(() -> "Log initialized. level=" + level.getName());
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb = parseInt(System.getProperty("cg.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("cg.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("gate-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 현재 루트 핸들러 (테스트/진단용) */
    static Handler[] handlers() { return Logger.getLogger("").getHandlers(); }

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
