package dev.badgersnacks.packmigrator.logging;

import dev.badgersnacks.packmigrator.services.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Per-session log file recording the milestones of conversion runs. Doubles as a
 * {@link ProgressSink}: phase messages and completed phases are written, single files are not.
 */
public final class ConversionLog implements ProgressSink, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionLog.class);
    private static final DateTimeFormatter FILE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());
    private static final DateTimeFormatter ENTRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final Path logFile;
    private final BufferedWriter writer;

    /** Logs to {@code ~/.pack-migrator/logs}. */
    public ConversionLog() {
        this(Path.of(System.getProperty("user.home"), ".pack-migrator", "logs"));
    }

    public ConversionLog(Path logsDirectory) {
        try {
            this.logFile = createLogFile(logsDirectory);
            this.writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            log("session:start", "Pack migrator logging to " + logFile.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to initialize conversion log", e);
        }
    }

    public Path getLogFile() {
        return logFile;
    }

    public void log(String action, String message) {
        log(action, message, null);
    }

    public synchronized void log(String action, String message, Throwable error) {
        try {
            writer.write(ENTRY_FORMAT.format(Instant.now()));
            writer.write(" [");
            writer.write(action);
            writer.write("] ");
            writer.write(message == null ? "" : message);
            writer.newLine();
            if (error != null) {
                StringWriter sw = new StringWriter();
                error.printStackTrace(new PrintWriter(sw));
                writer.write(sw.toString());
            }
            writer.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to write conversion log entry", e);
        }
    }

    @Override
    public void report(int completed, int total) {
        if (completed == total) {
            log("progress", completed + "/" + total + " done");
        }
    }

    @Override
    public void message(String text) {
        log("phase", text);
    }

    @Override
    public synchronized void close() {
        try {
            log("session:end", "Closing conversion log.");
            writer.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close conversion log", e);
        }
    }

    private static Path createLogFile(Path logsDirectory) throws IOException {
        Files.createDirectories(logsDirectory);
        String fileName = "pack-migrator-" + FILE_FORMAT.format(Instant.now()) + ".log";
        Path candidate = logsDirectory.resolve(fileName);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = logsDirectory.resolve("pack-migrator-" + FILE_FORMAT.format(Instant.now()) + "-" + suffix++ + ".log");
        }
        return candidate.toAbsolutePath();
    }
}
