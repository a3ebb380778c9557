package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ConversionReport;
import dev.badgersnacks.packmigrator.model.ItemDefinition;
import dev.badgersnacks.packmigrator.model.ParseFailure;
import dev.badgersnacks.packmigrator.model.PredicateOverride;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.scanner.AssetClassifier;
import dev.badgersnacks.packmigrator.scanner.ClassifiedAsset;
import dev.badgersnacks.packmigrator.scanner.ClassifiedAssets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Shared run of both conversion modes: classify the input, copy it to the output, rewrite every
 * legacy item definition, then update {@code pack.mcmeta}.
 */
public abstract class LegacyDefinitionConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LegacyDefinitionConverter.class);

    private final AssetClassifier classifier;
    private final PackMetaRewriter packMetaRewriter;

    protected LegacyDefinitionConverter(AssetClassifier classifier, PackMetaRewriter packMetaRewriter) {
        this.classifier = classifier;
        this.packMetaRewriter = packMetaRewriter;
    }

    protected abstract String phase();

    /**
     * Rewrites one definition into {@code output}, adding every asset it generates to {@code generated}.
     */
    protected abstract void convertDefinition(ItemDefinition definition,
                                              DefinitionScope scope,
                                              Set<AssetLocation> generated) throws IOException;

    public ConversionOutput convert(ResourceTree input, ResourceTree output, ConversionContext context)
            throws IOException {
        ConverterOptions options = context.options();
        ConversionReport.Builder report = new ConversionReport.Builder();
        ClassifiedAssets classified = classifier.classify(input, context);
        report.scanned(input.size()).skipped(classified.skipped().size());
        classified.failures().forEach(report::parseFailure);
        for (String path : input.paths()) {
            output.copyFrom(input, path);
        }

        ItemDefinitionReader reader = new ItemDefinitionReader(options.defaultNamespace());
        DefinitionScope scope = new DefinitionScope(input, output, new ReferenceResolver(input, options), options, report);
        List<ClassifiedAsset> definitions = classified.legacyItemDefinitions().collect(Collectors.toList());
        Set<AssetLocation> generated = new TreeSet<>();
        Set<String> rewritten = new TreeSet<>();
        context.progress().message("Converting " + definitions.size() + " item definitions (" + phase() + ")");
        int completed = 0;
        for (ClassifiedAsset asset : definitions) {
            ItemDefinition definition;
            try {
                definition = reader.read(asset);
            } catch (IOException e) {
                LOGGER.warn("Skipping item definition {}: {}", asset.path(), e.getMessage());
                report.parseFailure(new ParseFailure(asset.path(), e.getMessage())).skipped(1);
                context.checkpoint(phase(), ++completed, definitions.size());
                continue;
            }
            if (definition.overrides().isEmpty()) {
                LOGGER.debug("No custom model data overrides in {}, leaving it untouched", asset.path());
                context.checkpoint(phase(), ++completed, definitions.size());
                continue;
            }
            convertDefinition(definition, scope, generated);
            rewritten.add(definition.sourcePath());
            report.rewritten();
            context.checkpoint(phase(), ++completed, definitions.size());
        }
        if (packMetaRewriter.rewrite(output, options.profile())) {
            rewritten.add(PackMetaRewriter.PACK_META);
            report.rewritten();
        }
        ConversionReport result = report.build();
        LOGGER.info("{} conversion finished: {}", phase(), result.summary());
        return new ConversionOutput(result, generated, rewritten);
    }

    /**
     * Drops overrides whose model is missing from the input, unless the game provides it.
     */
    protected List<PredicateOverride> resolvableOverrides(ItemDefinition definition, DefinitionScope scope) {
        List<PredicateOverride> kept = new ArrayList<>();
        for (PredicateOverride override : definition.overrides()) {
            AssetLocation target = new AssetLocation(AssetKind.MODEL, override.modelReference());
            if (scope.resolver().find(target).isPresent()) {
                kept.add(override);
            } else if (scope.resolver().isProvidedByGame(target)) {
                LOGGER.debug("{} uses game model {}", definition.describe(override), target.id());
                kept.add(override);
            } else {
                LOGGER.warn("Dropping {}: model {} is not in the pack", definition.describe(override), target.id());
            }
        }
        return kept;
    }

    /**
     * Trees and services available while converting the definitions of one run.
     */
    protected record DefinitionScope(ResourceTree input,
                                     ResourceTree output,
                                     ReferenceResolver resolver,
                                     ConverterOptions options,
                                     ConversionReport.Builder report) {
    }
}
