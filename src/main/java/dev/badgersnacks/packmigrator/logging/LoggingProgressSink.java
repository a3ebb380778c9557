package dev.badgersnacks.packmigrator.logging;

import dev.badgersnacks.packmigrator.services.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards progress to SLF4J: phase messages at info, per-file progress at debug.
 */
public final class LoggingProgressSink implements ProgressSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressSink.class);

    private final String label;

    public LoggingProgressSink(String label) {
        this.label = label;
    }

    @Override
    public void report(int completed, int total) {
        LOGGER.debug("[{}] {}/{}", label, completed, total);
    }

    @Override
    public void message(String text) {
        LOGGER.info("[{}] {}", label, text);
    }

    /** Sink delivering every event to both {@code first} and {@code second}. */
    public static ProgressSink both(ProgressSink first, ProgressSink second) {
        return new ProgressSink() {
            @Override
            public void report(int completed, int total) {
                first.report(completed, total);
                second.report(completed, total);
            }

            @Override
            public void message(String text) {
                first.message(text);
                second.message(text);
            }
        };
    }
}
