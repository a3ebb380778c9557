package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.packmigrator.errors.UnresolvedReferenceException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.util.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps identifiers to files of one resource tree and back.
 */
public final class ReferenceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ResourceTree tree;
    private final ConverterOptions options;
    private final ReferenceExtractor extractor;

    public ReferenceResolver(ResourceTree tree, ConverterOptions options) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.options = Objects.requireNonNull(options, "options");
        this.extractor = new ReferenceExtractor(options.defaultNamespace());
    }

    public ResourceId parse(String raw) {
        return ResourceId.parse(raw, options.defaultNamespace());
    }

    /**
     * Pack path of the asset {@code id} addresses.
     *
     * @throws UnresolvedReferenceException when the tree holds no such asset
     */
    public String resolve(ResourceId id, AssetKind kind) throws UnresolvedReferenceException {
        return resolve(new AssetLocation(kind, id), null);
    }

    public String resolve(AssetLocation location, String referencedFrom) throws UnresolvedReferenceException {
        return find(location).orElseThrow(() ->
                new UnresolvedReferenceException(location.id().asString(), referencedFrom));
    }

    public Optional<String> find(AssetLocation location) {
        String path = location.relativePath();
        return tree.contains(path) ? Optional.of(path) : Optional.empty();
    }

    public Optional<AssetLocation> identify(String path) {
        return AssetLocation.fromRelativePath(path);
    }

    /**
     * True when the asset is missing from the pack but lives in a namespace the game supplies, so
     * the game resolves it at runtime.
     */
    public boolean isProvidedByGame(AssetLocation location) {
        return options.isBuiltIn(location.id().namespace()) && find(location).isEmpty();
    }

    /**
     * Reads a model through its identifier, or empty when it is neither in the tree nor readable.
     */
    public Optional<JsonNode> readModel(ResourceId id) {
        Optional<String> path = find(new AssetLocation(AssetKind.MODEL, id));
        if (path.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = tree.readJson(path.get());
            return node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (IOException e) {
            LOGGER.debug("Model {} at {} is unreadable: {}", id, path.get(), e.getMessage());
            return Optional.empty();
        }
    }

    public ReferenceExtractor extractor() {
        return extractor;
    }

    /**
     * Builds the reverse reference graph of every readable model and item definition document.
     */
    public ReferenceIndex index() {
        ReferenceIndex index = new ReferenceIndex();
        for (String path : tree.paths()) {
            Optional<AssetLocation> location = identify(path);
            if (location.isEmpty() || location.get().kind() == AssetKind.TEXTURE) {
                continue;
            }
            try {
                extractor.extract(path, tree.readJson(path)).forEach(index::add);
            } catch (IOException e) {
                LOGGER.debug("Not indexing unreadable document {}: {}", path, e.getMessage());
            }
        }
        LOGGER.debug("Indexed {} references to {} assets", index.size(), index.targets().size());
        return index;
    }
}
