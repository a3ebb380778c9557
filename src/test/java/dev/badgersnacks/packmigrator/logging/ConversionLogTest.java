package dev.badgersnacks.packmigrator.logging;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionLogTest {

    @TempDir
    Path tempDir;

    @Test
    void recordsPhasesAndCompletedWork() throws IOException {
        Path logFile;
        try (ConversionLog log = new ConversionLog(tempDir)) {
            logFile = log.getLogFile();
            log.message("Scanning 3 files");
            log.report(1, 3);
            log.report(3, 3);
            log.log("convert:failed", "boom", new IllegalStateException("bad state"));
        }

        String content = Files.readString(logFile);
        assertTrue(logFile.getFileName().toString().startsWith("pack-migrator-"));
        assertTrue(content.contains("[session:start]"));
        assertTrue(content.contains("[phase] Scanning 3 files"));
        assertFalse(content.contains("1/3"));
        assertTrue(content.contains("3/3 done"));
        assertTrue(content.contains("IllegalStateException: bad state"));
        assertTrue(content.contains("[session:end]"));
    }

    @Test
    void sessionsInTheSameSecondGetDistinctFiles() {
        try (ConversionLog first = new ConversionLog(tempDir);
             ConversionLog second = new ConversionLog(tempDir)) {
            assertNotEquals(first.getLogFile(), second.getLogFile());
        }
    }
}
