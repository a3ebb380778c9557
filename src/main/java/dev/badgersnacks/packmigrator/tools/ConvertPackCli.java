package dev.badgersnacks.packmigrator.tools;

import dev.badgersnacks.packmigrator.errors.ConversionException;
import dev.badgersnacks.packmigrator.logging.ConversionLog;
import dev.badgersnacks.packmigrator.logging.LoggingProgressSink;
import dev.badgersnacks.packmigrator.model.ConversionMode;
import dev.badgersnacks.packmigrator.model.ConversionResult;
import dev.badgersnacks.packmigrator.model.ParseFailure;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.ConverterSettings;
import dev.badgersnacks.packmigrator.services.ConversionContext;
import dev.badgersnacks.packmigrator.services.ResourcePackConverter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;

/**
 * Command line entry point converting one resource pack into a timestamped archive.
 */
public final class ConvertPackCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE = """
            Usage: ConvertPackCli <cmd|item-model> <input> <outputFolder> [settings.json]

            <cmd|item-model> cmd rewrites custom model data for the target version,
                             item-model splits every override into a standalone model.
            <input>          Resource pack folder or .zip archive.
            <outputFolder>   Folder receiving converted_<timestamp>.zip (created automatically).
            [settings.json]  Optional converter settings; defaults target 1.21.4.
            """;

    private ConvertPackCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, null));
    }

    /**
     * Runs the conversion and returns the process exit code.
     *
     * @param logsDirectory where the session log goes, or {@code null} for the user's default
     */
    static int run(String[] args, PrintStream out, PrintStream err, Path logsDirectory) {
        if (args.length < 3 || args.length > 4) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        ConversionMode mode;
        try {
            mode = ConversionMode.fromArgument(args[0]);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path input = Paths.get(args[1]).toAbsolutePath().normalize();
        Path outputFolder = Paths.get(args[2]).toAbsolutePath().normalize();
        if (!Files.exists(input)) {
            err.printf("Input %s does not exist%n", input);
            return EXIT_USAGE;
        }
        ConverterOptions options = args.length == 4
                ? new ConverterSettings().load(Paths.get(args[3]).toAbsolutePath().normalize())
                : ConverterOptions.defaults();

        try (ConversionLog log = logsDirectory == null ? new ConversionLog() : new ConversionLog(logsDirectory)) {
            log.log("convert:start", mode.argument() + " " + input + " -> " + outputFolder
                    + " (target " + options.profile() + ", " + options.encoding() + ")");
            ConversionContext context = ConversionContext.of(options)
                    .withProgress(LoggingProgressSink.both(new LoggingProgressSink(mode.argument()), log));
            try {
                Files.createDirectories(outputFolder);
                ConversionResult result = new ResourcePackConverter()
                        .convertPack(input, outputFolder, mode, LocalDateTime.now(), context);
                log.log("convert:done", result.archive() + " " + result.report().summary());
                out.printf("Converted %s. Archive written to %s%n", input.getFileName(), result.archive());
                out.printf("  %s%n", result.report().summary());
                for (ParseFailure failure : result.report().parseFailures()) {
                    out.printf("  skipped %s: %s%n", failure.path(), failure.message());
                }
                return EXIT_OK;
            } catch (ConversionException e) {
                log.log("convert:failed", e.getMessage(), e);
                err.println("Conversion failed: " + e.getMessage());
                e.locations().forEach(location -> err.println("  at " + location));
                return EXIT_FAILURE;
            } catch (IOException e) {
                log.log("convert:failed", e.getMessage(), e);
                err.println("Conversion failed: " + e.getMessage());
                return EXIT_FAILURE;
            }
        }
    }
}
