package com.quizharvester.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * CLI용 java.util.logging 전역 설정.
 * SLF4J(slf4j-jdk14) 로그와 StructuredLog 이벤트 줄이 같은 핸들러로 나간다.
 * <ul>
 *   <li>콘솔(stderr) + &lt;출력 폴더&gt;/logs/harvest-%g.log 사이즈 롤링(기본 2MB x 5)</li>
 *   <li>-Dqh.log.level / qh.log.sizeMb / qh.log.files / qh.log.console</li>
 * </ul>
 * 프로세스당 한 번만 적용된다.
 */
public final class LogSetup {
    private LogSetup() {}

    static final String FILE_PATTERN = "harvest-%g.log";

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** 시스템 프로퍼티에서 읽은 설정값 */
    record Settings(Level level, int sizeMb, int files, boolean console) {
        static Settings from(Properties props) {
            return new Settings(
                    levelOf(props.getProperty("qh.log.level", "INFO")),
                    Math.max(1, parseInt(props.getProperty("qh.log.sizeMb"), 2)),
                    Math.max(1, parseInt(props.getProperty("qh.log.files"), 5)),
                    !"false".equalsIgnoreCase(props.getProperty("qh.log.console", "true")));
        }
    }

    /** outRoot/logs 아래로 기록 */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"), Settings.from(System.getProperties()));
    }

    static synchronized void init(Path logDir, Settings s) {
        if (initialized) return;
        initialized = true;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(s.level());

        if (s.console()) {
            root.addHandler(withFormat(new ConsoleHandler(), s.level()));
        }
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve(FILE_PATTERN).toString();
            root.addHandler(withFormat(new FileHandler(pattern, s.sizeMb() * 1024 * 1024, s.files(), true), s.level()));
        } catch (IOException e) {
            // 파일 로그 없이 계속(콘솔만)
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
            return;
        }
        Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                () -> "Logging to " + logDir.toAbsolutePath() + " at " + s.level().getName());
    }

    private static Handler withFormat(Handler h, Level level) {
        h.setLevel(level);
        h.setFormatter(LINE_FORMATTER);
        return h;
    }

    /** --verbose 등 실행 중 레벨 변경(루트 + 모든 핸들러) */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) h.setLevel(lv);
    }

    /** 이름 → Level, 모르면 INFO */
    public static Level levelOf(String name) {
        if (name == null) return Level.INFO;
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 시각 [레벨] (스레드) 로거 - 메시지 (+ 스택) */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String line = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));
            if (r.getThrown() == null) return line;

            StringWriter trace = new StringWriter(256);
            r.getThrown().printStackTrace(new PrintWriter(trace));
            return line + trace + System.lineSeparator();
        }
    }
}
