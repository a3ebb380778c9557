package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ConversionMode;
import dev.badgersnacks.packmigrator.model.ConversionReport;
import dev.badgersnacks.packmigrator.model.ConversionResult;
import dev.badgersnacks.packmigrator.persistence.ArchiveBuilder;
import dev.badgersnacks.packmigrator.persistence.PackStager;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Entry points of the conversion core. Every call takes its own {@link ConversionContext}; the
 * converter itself holds no per-run state and may be shared between threads.
 */
public class ResourcePackConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourcePackConverter.class);
    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CustomModelDataConverter customModelDataConverter;
    private final ItemModelConverter itemModelConverter;
    private final FolderStructureNormalizer normalizer;
    private final ReferenceValidator validator;
    private final ArchiveBuilder archiveBuilder;
    private final PackStager stager;

    public ResourcePackConverter() {
        this(new CustomModelDataConverter(), new ItemModelConverter(), new FolderStructureNormalizer(),
                new ReferenceValidator(), new ArchiveBuilder(), new PackStager());
    }

    public ResourcePackConverter(CustomModelDataConverter customModelDataConverter,
                                 ItemModelConverter itemModelConverter,
                                 FolderStructureNormalizer normalizer,
                                 ReferenceValidator validator,
                                 ArchiveBuilder archiveBuilder,
                                 PackStager stager) {
        this.customModelDataConverter = Objects.requireNonNull(customModelDataConverter, "customModelDataConverter");
        this.itemModelConverter = Objects.requireNonNull(itemModelConverter, "itemModelConverter");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.archiveBuilder = Objects.requireNonNull(archiveBuilder, "archiveBuilder");
        this.stager = Objects.requireNonNull(stager, "stager");
    }

    /**
     * Rewrites custom model data overrides of {@code inputDir} into {@code outputDir}. The output is
     * not yet in its final layout; run {@link #normalizeFolderStructure} before archiving it.
     */
    public ConversionReport convertCustomModelData(Path inputDir, Path outputDir, ConversionContext context)
            throws IOException {
        ResourceTree input = ResourceTree.load(inputDir, context.options());
        ResourceTree output = ResourceTree.empty();
        ConversionOutput result = customModelDataConverter.convert(input, output, context);
        output.flush(outputDir);
        return result.report();
    }

    /**
     * Moves the files of {@code outputDir} into the layout of the target version, in place. The
     * directory is only touched once every reference of the moved and rewritten files resolves.
     */
    public Set<AssetLocation> normalizeFolderStructure(Path outputDir, ConversionContext context) throws IOException {
        ResourceTree tree = ResourceTree.load(outputDir, context.options());
        Set<AssetLocation> relocated = normalizer.normalize(tree, context);
        validator.validate(tree, context.options(), relocated, tree.changedPaths());
        tree.flush(outputDir);
        return relocated;
    }

    /**
     * Splits the legacy item definitions of {@code inputDir} into standalone models and item
     * definitions written to {@code outputDir}.
     */
    public ConversionReport convertItemModel(Path inputDir, Path outputDir, ConversionContext context)
            throws IOException {
        ResourceTree input = ResourceTree.load(inputDir, context.options());
        ResourceTree output = ResourceTree.empty();
        ConversionOutput result = itemModelConverter.convert(input, output, context);
        validator.validate(output, context.options(), result.generated(), result.writtenDocuments());
        output.flush(outputDir);
        return result.report();
    }

    public void buildArchive(Path outputDir, Path destinationZip, ConversionContext context) throws IOException {
        archiveBuilder.build(ResourceTree.load(outputDir, context.options()), destinationZip, context);
    }

    /**
     * Whole run: stages {@code input} (folder or ZIP), converts it in {@code mode} and writes
     * {@code converted_<timestamp>.zip} into {@code outputDirectory}. Staging directories are
     * private to the call and removed afterwards, whatever the outcome.
     */
    public ConversionResult convertPack(Path input,
                                        Path outputDirectory,
                                        ConversionMode mode,
                                        LocalDateTime timestamp,
                                        ConversionContext context) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(mode, "mode");
        Path workspace = Files.createTempDirectory("pack-migrator-");
        try {
            Path staged = workspace.resolve("input");
            Path converted = workspace.resolve("output");
            context.progress().message("Staging " + input.getFileName());
            stager.stage(input, staged, context);

            ConversionReport report;
            if (mode == ConversionMode.CUSTOM_MODEL_DATA) {
                report = convertCustomModelData(staged, converted, context);
                normalizeFolderStructure(converted, context);
            } else {
                report = convertItemModel(staged, converted, context);
            }

            Path archive = outputDirectory.resolve(archiveName(timestamp));
            buildArchive(converted, archive, context);
            LOGGER.info("{} conversion of {} written to {}: {}", mode, input, archive, report.summary());
            return new ConversionResult(mode, archive, report);
        } finally {
            deleteRecursively(workspace);
        }
    }

    public static String archiveName(LocalDateTime timestamp) {
        return "converted_" + ARCHIVE_STAMP.format(timestamp) + ".zip";
    }

    private static void deleteRecursively(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warn("Could not remove staging directory {}", root, e);
        }
    }
}
