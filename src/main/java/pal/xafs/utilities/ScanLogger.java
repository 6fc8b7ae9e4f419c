package pal.xafs.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Copies all {@code pal.xafs} log output of one scan into {@code <directory>/acquisition.log}.
 *
 * <pre>{@code
 * try (ScanLogger.Session session = ScanLogger.start(runDirectory)) {
 *     orchestrator.run(request);
 * }
 * }</pre>
 */
public class ScanLogger {
    private static final Logger logger = LoggerFactory.getLogger(ScanLogger.class);

    static final String APPENDER_NAME = "SCAN_LOG";
    static final String LOG_FILE = "acquisition.log";
    private static final String ROOT_PACKAGE = "pal.xafs";

    private static FileAppender<ILoggingEvent> current;

    private ScanLogger() {
    }

    /**
     * @param directory existing directory to write {@code acquisition.log} into
     * @return true if the appender was attached
     */
    public static synchronized boolean enable(File directory) {
        if (directory == null || !directory.isDirectory()) {
            logger.warn("Cannot enable scan logging: invalid directory: {}", directory);
            return false;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Scan logging needs Logback as the SLF4J backend");
            return false;
        }
        detach(context);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(new File(directory, LOG_FILE).getAbsolutePath());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(ROOT_PACKAGE).addAppender(appender);
        current = appender;
        logger.info("Scan logging enabled: {}", appender.getFile());
        return true;
    }

    public static synchronized void disable() {
        if (current == null) {
            return;
        }
        logger.info("Scan logging disabled: {}", current.getFile());
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            detach(context);
        }
    }

    public static synchronized boolean isEnabled() {
        return current != null;
    }

    public static synchronized String getCurrentLogFile() {
        return current == null ? null : current.getFile();
    }

    public static Session start(File directory) {
        return new Session(directory);
    }

    private static void detach(LoggerContext context) {
        if (current != null) {
            context.getLogger(ROOT_PACKAGE).detachAppender(current);
            current.stop();
            current = null;
        }
    }

    /**
     * Scan logging bound to a try-with-resources block.
     */
    public static final class Session implements AutoCloseable {
        private final boolean enabled;

        private Session(File directory) {
            this.enabled = enable(directory);
        }

        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public void close() {
            if (enabled) {
                disable();
            }
        }
    }
}
