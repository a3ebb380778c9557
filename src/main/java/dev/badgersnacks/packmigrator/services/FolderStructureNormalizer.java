package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.errors.ConversionException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.RelocationRule;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.scanner.AssetClassifier;
import dev.badgersnacks.packmigrator.scanner.AssetShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Moves the files of a converted tree into the layout its target version reads, rewriting every
 * reference to a moved model or texture.
 *
 * <p>The whole plan is computed against one {@link ReferenceIndex} and applied to the in-memory
 * tree. Nothing reaches the disk until the caller flushes, which writes new files before deleting
 * vacated ones.
 */
public class FolderStructureNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FolderStructureNormalizer.class);
    static final String PHASE = "normalize";

    /** Top-level keys an item definition file may carry. */
    static final List<String> ITEM_DEFINITION_KEYS = List.of("model", "hand_animation_on_swap", "oversized_in_gui");

    private final AssetClassifier classifier;

    public FolderStructureNormalizer() {
        this(new AssetClassifier());
    }

    public FolderStructureNormalizer(AssetClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Applies the layout of {@code context}'s options to {@code tree}.
     *
     * @return the locations files were moved to, which must resolve afterwards
     */
    public Set<AssetLocation> normalize(ResourceTree tree, ConversionContext context) throws IOException {
        ConverterOptions options = context.options();
        List<RelocationRule> rules = options.layout();
        Set<AssetLocation> relocated = new TreeSet<>();
        if (rules.isEmpty()) {
            LOGGER.info("No relocation rules for {}, layout unchanged", options.encoding());
            return relocated;
        }

        List<Relocation> plan = plan(tree, rules);
        if (plan.isEmpty()) {
            LOGGER.info("Tree already matches the {} layout", options.encoding());
            return relocated;
        }
        rejectConflicts(tree, plan);

        ReferenceResolver resolver = new ReferenceResolver(tree, options);
        ReferenceIndex index = resolver.index();
        SortedMap<String, ObjectNode> edited = new TreeMap<>();
        for (Relocation relocation : plan) {
            if (relocation.kind() == AssetKind.ITEM_DEFINITION) {
                continue;
            }
            Optional<AssetLocation> target = AssetLocation.fromRelativePath(relocation.to());
            if (target.isEmpty()) {
                continue;
            }
            for (Reference reference : index.referencesTo(relocation.location())) {
                ObjectNode document = edited.get(reference.documentPath());
                if (document == null) {
                    document = tree.readJson(reference.documentPath()).deepCopy();
                    edited.put(reference.documentPath(), document);
                }
                resolver.extractor().rewrite(document, reference, target.get().id());
                LOGGER.debug("Rewrote {} to {}", reference.describe(), target.get().id());
            }
        }

        context.progress().message("Relocating " + plan.size() + " files");
        int completed = 0;
        for (Relocation relocation : plan) {
            ObjectNode document = edited.remove(relocation.from());
            if (relocation.kind() == AssetKind.ITEM_DEFINITION) {
                split(tree, relocation, document != null ? document : (ObjectNode) tree.readJson(relocation.from()));
            } else if (document != null) {
                tree.putDocument(relocation.to(), document);
                tree.remove(relocation.from());
            } else {
                tree.move(relocation.from(), relocation.to());
            }
            AssetLocation.fromRelativePath(relocation.to()).ifPresent(relocated::add);
            LOGGER.debug("Moved {} {} to {}", relocation.kind(), relocation.from(), relocation.to());
            context.checkpoint(PHASE, ++completed, plan.size());
        }
        for (Map.Entry<String, ObjectNode> remaining : edited.entrySet()) {
            tree.putDocument(remaining.getKey(), remaining.getValue());
        }
        LOGGER.info("Relocated {} files and rewrote references in {} others", plan.size(), edited.size());
        return relocated;
    }

    private List<Relocation> plan(ResourceTree tree, List<RelocationRule> rules) {
        List<Relocation> plan = new ArrayList<>();
        for (String path : tree.paths()) {
            Optional<AssetLocation> location = AssetLocation.fromRelativePath(path);
            if (location.isEmpty()) {
                continue;
            }
            AssetKind kind = kindOf(tree, path, location.get());
            for (RelocationRule rule : rules) {
                if (rule.kind() != kind) {
                    continue;
                }
                Optional<String> target = rule.relocate(path);
                if (target.isPresent() && !target.get().equals(path)) {
                    plan.add(new Relocation(path, target.get(), kind, location.get()));
                    break;
                }
            }
        }
        return plan;
    }

    /**
     * Kind a relocation rule sees: documents carrying a top-level {@code model} tree count as item
     * definitions wherever they sit, everything else by its directory. Legacy item models left
     * untouched by the converter stay models.
     */
    private AssetKind kindOf(ResourceTree tree, String path, AssetLocation location) {
        if (location.kind() == AssetKind.TEXTURE) {
            return AssetKind.TEXTURE;
        }
        try {
            boolean itemDefinition = classifier.classify(path, tree.readJson(path))
                    .map(asset -> asset.shape() == AssetShape.ITEM_DEFINITION)
                    .orElse(false);
            return itemDefinition ? AssetKind.ITEM_DEFINITION : location.kind();
        } catch (IOException e) {
            LOGGER.debug("Leaving unreadable {} in place: {}", path, e.getMessage());
            return location.kind();
        }
    }

    private static void rejectConflicts(ResourceTree tree, List<Relocation> plan) throws ConversionException {
        Set<String> vacated = new TreeSet<>();
        Set<String> targets = new TreeSet<>();
        for (Relocation relocation : plan) {
            if (relocation.kind() != AssetKind.ITEM_DEFINITION) {
                vacated.add(relocation.from());
            }
        }
        for (Relocation relocation : plan) {
            boolean occupied = tree.contains(relocation.to()) && !vacated.contains(relocation.to());
            if (occupied || !targets.add(relocation.to())) {
                throw new ConversionException("Cannot move " + relocation.from() + ": " + relocation.to()
                        + " is already taken", List.of(relocation.from(), relocation.to()));
            }
        }
    }

    /**
     * Moves the item definition part of a hybrid document to its new location. The remaining
     * model declaration stays behind, or is removed when nothing is left.
     */
    private static void split(ResourceTree tree, Relocation relocation, ObjectNode source) {
        if (!source.path("model").isObject()) {
            throw new IllegalStateException(relocation.from() + " has no item model to relocate");
        }
        ObjectNode definition = JsonNodeFactory.instance.objectNode();
        ObjectNode declaration = source.deepCopy();
        for (String key : ITEM_DEFINITION_KEYS) {
            JsonNode value = declaration.remove(key);
            if (value != null) {
                definition.set(key, value);
            }
        }
        tree.putDocument(relocation.to(), definition);
        if (declaration.isEmpty()) {
            tree.remove(relocation.from());
        } else {
            tree.putDocument(relocation.from(), declaration);
        }
    }

    private record Relocation(String from, String to, AssetKind kind, AssetLocation location) {
    }
}
