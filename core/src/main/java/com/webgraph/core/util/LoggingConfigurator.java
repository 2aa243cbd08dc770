package com.webgraph.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 루트 설정: 콘솔 + 사이즈 롤링 파일(crawler-%g.log).
 * SLF4J 로그도 slf4j-jdk14 바인딩을 통해 같은 핸들러로 흐른다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final String FILE_PATTERN = "crawler-%g.log";

    /** -Dwg.log.level 또는 INFO */
    public static Level levelFromSystem() {
        return levelOf(System.getProperty("wg.log.level", "INFO"));
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /**
     * 기존 루트 핸들러를 제거하고 콘솔/파일 핸들러를 설치.
     * 파일 핸들러 생성 실패 시 콘솔만으로 계속하고 false 반환.
     */
    public static synchronized boolean init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        Formatter line = new LineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(line);
        root.addHandler(console);
        root.setLevel(rootLevel);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve(FILE_PATTERN).toString();
            FileHandler file = new FileHandler(pattern, Math.max(1024, maxBytes), Math.max(1, fileCount), true);
            file.setLevel(rootLevel);
            file.setFormatter(line); // 같은 포맷
            root.addHandler(file);
            return true;
        } catch (IOException e) {
            Logger.getLogger(LoggingConfigurator.class.getName())
                    .log(Level.WARNING, "File log handler disabled: " + e.getMessage(), e);
            return false;
        }
    }

    /** 한 줄 포맷: 시각 [레벨] 로거 - 메시지 (+스택) */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(), r.getLoggerName(), formatMessage(r)));
            if (r.getThrown() != null) {
                java.io.StringWriter sw = new java.io.StringWriter();
                r.getThrown().printStackTrace(new java.io.PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }
    }
}
