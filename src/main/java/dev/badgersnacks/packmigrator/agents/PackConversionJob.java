package dev.badgersnacks.packmigrator.agents;

import dev.badgersnacks.packmigrator.model.ConversionMode;
import dev.badgersnacks.packmigrator.model.ConversionResult;
import dev.badgersnacks.packmigrator.services.ConversionContext;
import dev.badgersnacks.packmigrator.services.ResourcePackConverter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Converts one pack, folder or ZIP, into a timestamped archive in the background.
 */
public class PackConversionJob implements ConversionJob<ConversionResult> {

    private final Path input;
    private final Path outputDirectory;
    private final ConversionMode mode;
    private final LocalDateTime timestamp;
    private final ResourcePackConverter converter;

    public PackConversionJob(Path input,
                             Path outputDirectory,
                             ConversionMode mode,
                             LocalDateTime timestamp,
                             ResourcePackConverter converter) {
        this.input = Objects.requireNonNull(input, "input");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    @Override
    public String name() {
        return "convert-" + mode.argument();
    }

    @Override
    public ConversionResult run(ConversionContext context) throws Exception {
        return converter.convertPack(input, outputDirectory, mode, timestamp, context);
    }
}
