package dev.badgersnacks.packmigrator.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.packmigrator.errors.ConversionCancelledException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ParseFailure;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.services.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a resource tree and sorts its files into item definitions, models and everything else.
 */
public class AssetClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssetClassifier.class);
    static final String PHASE = "classify";

    public ClassifiedAssets classify(ResourceTree tree, ConversionContext context) throws ConversionCancelledException {
        List<ClassifiedAsset> assets = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        List<String> paths = tree.paths();
        context.progress().message("Scanning " + paths.size() + " files");
        int completed = 0;
        for (String path : paths) {
            Optional<ClassifiedAsset> asset = Optional.empty();
            if (ResourceTree.isJsonPath(path)) {
                try {
                    asset = classify(path, tree.readJson(path));
                } catch (IOException e) {
                    LOGGER.warn("Skipping unreadable JSON {}: {}", path, e.getMessage());
                    failures.add(new ParseFailure(path, e.getMessage()));
                }
            }
            if (asset.isPresent()) {
                assets.add(asset.get());
            } else {
                skipped.add(path);
            }
            context.checkpoint(PHASE, ++completed, paths.size());
        }
        LOGGER.info("Classified {} files: {} assets, {} skipped, {} unreadable",
                paths.size(), assets.size(), skipped.size(), failures.size());
        return new ClassifiedAssets(assets, skipped, failures);
    }

    /**
     * Classifies a single parsed document by its location and top-level shape.
     */
    public Optional<ClassifiedAsset> classify(String path, JsonNode document) {
        Optional<AssetLocation> location = AssetLocation.fromRelativePath(path);
        if (location.isEmpty() || document == null || !document.isObject()) {
            return Optional.empty();
        }
        AssetLocation assetLocation = location.get();
        boolean hasModelObject = document.path("model").isObject();
        if (assetLocation.kind() == AssetKind.ITEM_DEFINITION) {
            return hasModelObject
                    ? Optional.of(new ClassifiedAsset(path, assetLocation, AssetShape.ITEM_DEFINITION, document))
                    : Optional.empty();
        }
        if (assetLocation.kind() != AssetKind.MODEL) {
            return Optional.empty();
        }
        if (hasModelObject) {
            return Optional.of(new ClassifiedAsset(path, assetLocation, AssetShape.ITEM_DEFINITION, document));
        }
        if (document.path("overrides").isArray() && assetLocation.id().path().startsWith("item/")) {
            return Optional.of(new ClassifiedAsset(path, assetLocation, AssetShape.LEGACY_ITEM_DEFINITION, document));
        }
        return Optional.of(new ClassifiedAsset(path, assetLocation, AssetShape.MODEL, document));
    }
}
