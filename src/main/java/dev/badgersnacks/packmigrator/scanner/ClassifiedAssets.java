package dev.badgersnacks.packmigrator.scanner;

import dev.badgersnacks.packmigrator.model.ParseFailure;

import java.util.List;
import java.util.stream.Stream;

/**
 * Result of classifying a tree: item definitions and models are disjoint, everything else is
 * listed as skipped.
 */
public final class ClassifiedAssets {
    private final List<ClassifiedAsset> assets;
    private final List<String> skipped;
    private final List<ParseFailure> failures;

    ClassifiedAssets(List<ClassifiedAsset> assets, List<String> skipped, List<ParseFailure> failures) {
        this.assets = List.copyOf(assets);
        this.skipped = List.copyOf(skipped);
        this.failures = List.copyOf(failures);
    }

    public Stream<ClassifiedAsset> itemDefinitions() {
        return assets.stream().filter(asset -> asset.shape().isItemDefinition());
    }

    public Stream<ClassifiedAsset> legacyItemDefinitions() {
        return assets.stream().filter(asset -> asset.shape() == AssetShape.LEGACY_ITEM_DEFINITION);
    }

    public Stream<ClassifiedAsset> models() {
        return assets.stream().filter(asset -> asset.shape() == AssetShape.MODEL);
    }

    public List<String> skipped() {
        return skipped;
    }

    public List<ParseFailure> failures() {
        return failures;
    }

    public int size() {
        return assets.size() + skipped.size();
    }
}
