package dev.badgersnacks.packmigrator.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a whole conversion run: the archive that was written and the counters behind it.
 */
public record ConversionResult(ConversionMode mode, Path archive, ConversionReport report) {

    public ConversionResult {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(report, "report");
    }
}
