package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.errors.DuplicateVariantException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ItemDefinition;
import dev.badgersnacks.packmigrator.model.ModelVariant;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.model.PredicateOverride;
import dev.badgersnacks.packmigrator.scanner.AssetClassifier;
import dev.badgersnacks.packmigrator.util.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Splits every legacy item definition into standalone models, one per custom model data value
 * plus the base, and writes item definitions addressing them.
 *
 * <p>For {@code item/stick} with an override on 1001 the output holds the models
 * {@code item/stick} and {@code item/stick_1001}, the root definition {@code items/stick.json}
 * dispatching between them, and {@code items/stick_1001.json} addressing the variant directly.
 * The root uses {@code range_dispatch} unless the options force {@code select}; a value without
 * an override falls back to the base either way.
 */
public class ItemModelConverter extends LegacyDefinitionConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemModelConverter.class);
    private static final String ITEM_PREFIX = "item/";
    private static final List<String> MERGED_SECTIONS = List.of("textures", "display");

    public ItemModelConverter() {
        this(new AssetClassifier(), new PackMetaRewriter());
    }

    public ItemModelConverter(AssetClassifier classifier, PackMetaRewriter packMetaRewriter) {
        super(classifier, packMetaRewriter);
    }

    @Override
    protected String phase() {
        return "item model";
    }

    @Override
    protected void convertDefinition(ItemDefinition definition, DefinitionScope scope, Set<AssetLocation> generated)
            throws DuplicateVariantException {
        if (definition.otherOverrideCount() > 0) {
            LOGGER.warn("Dropping {} overrides of {} that are not plain custom model data",
                    definition.otherOverrideCount(), definition.sourcePath());
        }
        Map<ResourceId, String> claimed = new HashMap<>();
        for (PredicateOverride override : definition.overrides()) {
            ResourceId variantId = variantId(definition, override.customModelDataValue());
            String previous = claimed.putIfAbsent(variantId, definition.describe(override));
            if (previous != null) {
                throw new DuplicateVariantException(variantId, previous, definition.describe(override));
            }
        }

        List<ModelVariant> variants = new ArrayList<>();
        ObjectNode base = definition.baseDeclaration().deepCopy();
        variants.add(new ModelVariant(definition.modelId(), null, base, definition.sourcePath()));
        for (PredicateOverride override : resolvableOverrides(definition, scope)) {
            ResourceId variantId = variantId(definition, override.customModelDataValue());
            AssetLocation location = new AssetLocation(AssetKind.MODEL, variantId);
            if (!variantId.equals(override.modelReference())) {
                rejectOccupied(scope, location, definition.describe(override));
            }
            variants.add(new ModelVariant(variantId, override.customModelDataValue(),
                    variantModel(definition, override, scope), definition.describe(override)));
        }

        ResourceId descriptorId = descriptorId(definition.modelId());
        boolean byString = scope.options().encoding() == PredicateEncoding.SELECT;
        ObjectNode dispatch = byString
                ? ItemModelNodes.select(definition.modelId())
                : ItemModelNodes.rangeDispatch(definition.modelId());
        for (ModelVariant variant : variants) {
            scope.output().putDocument(variant.location().relativePath(), variant.model());
            generated.add(variant.location());
            if (variant.isBase()) {
                continue;
            }
            if (byString) {
                ItemModelNodes.addCase(dispatch, variant.discriminator(), variant.id());
            }
            AssetLocation standalone = new AssetLocation(AssetKind.ITEM_DEFINITION,
                    descriptorId.withPath(descriptorId.path() + "_" + variant.discriminator()));
            rejectOccupied(scope, standalone, variant.source());
            scope.output().putDocument(standalone.relativePath(),
                    ItemModelNodes.definition(ItemModelNodes.plainModel(variant.id())));
            generated.add(standalone);
        }
        if (!byString) {
            addExactThresholds(dispatch, variants, definition.modelId());
        }
        AssetLocation root = new AssetLocation(AssetKind.ITEM_DEFINITION, descriptorId);
        rejectOccupied(scope, root, definition.sourcePath());
        scope.output().putDocument(root.relativePath(), ItemModelNodes.definition(dispatch));
        generated.add(root);
        scope.report().variants(variants.size());
        LOGGER.debug("Split {} into {} model variants", definition.sourcePath(), variants.size());
    }

    /**
     * Thresholds in ascending order where each value selects its own variant and the next integer
     * falls back to the base again, so values without an override render as the base item.
     */
    private static void addExactThresholds(ObjectNode rangeDispatch, List<ModelVariant> variants, ResourceId base) {
        TreeMap<Integer, ResourceId> byValue = new TreeMap<>();
        for (ModelVariant variant : variants) {
            if (!variant.isBase()) {
                byValue.put(variant.discriminator(), variant.id());
            }
        }
        for (Map.Entry<Integer, ResourceId> entry : byValue.entrySet()) {
            int value = entry.getKey();
            ItemModelNodes.addThreshold(rangeDispatch, value, entry.getValue());
            if (value < Integer.MAX_VALUE && !byValue.containsKey(value + 1)) {
                ItemModelNodes.addThreshold(rangeDispatch, value + 1, base);
            }
        }
    }

    /** {@code <ns>:item/<item>_<cmd>}, in the namespace of the legacy definition. */
    static ResourceId variantId(ItemDefinition definition, int customModelData) {
        return definition.modelId().withPath(definition.modelId().path() + "_" + customModelData);
    }

    /** Item definition identifier of a legacy model: {@code minecraft:item/stick} becomes {@code minecraft:stick}. */
    static ResourceId descriptorId(ResourceId modelId) {
        String path = modelId.path();
        return path.startsWith(ITEM_PREFIX) ? modelId.withPath(path.substring(ITEM_PREFIX.length())) : modelId;
    }

    private static void rejectOccupied(DefinitionScope scope, AssetLocation location, String source)
            throws DuplicateVariantException {
        String path = location.relativePath();
        if (scope.input().contains(path)) {
            throw new DuplicateVariantException(location.id(), path, source);
        }
    }

    /**
     * The base declaration overlaid by the override's model. Textures and display merge key-wise
     * when both models share a parent; an override with its own parent replaces the base entirely.
     * A model only the game provides becomes a thin child of it.
     */
    private ObjectNode variantModel(ItemDefinition definition, PredicateOverride override, DefinitionScope scope) {
        Optional<JsonNode> resolved = scope.resolver().readModel(override.modelReference());
        if (resolved.isEmpty()) {
            ObjectNode child = JsonNodeFactory.instance.objectNode();
            child.put("parent", override.modelReference().asString());
            return child;
        }
        ObjectNode declaration = resolved.get().deepCopy();
        declaration.remove("overrides");
        declaration.remove("model");
        if (!sharesParent(definition.baseDeclaration(), declaration, scope)) {
            return declaration;
        }
        ObjectNode merged = definition.baseDeclaration().deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = declaration.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = merged.get(field.getKey());
            if (MERGED_SECTIONS.contains(field.getKey()) && field.getValue().isObject()
                    && existing != null && existing.isObject()) {
                ((ObjectNode) existing).setAll((ObjectNode) field.getValue());
            } else {
                merged.set(field.getKey(), field.getValue());
            }
        }
        return merged;
    }

    private static boolean sharesParent(ObjectNode base, ObjectNode declaration, DefinitionScope scope) {
        JsonNode overrideParent = declaration.get("parent");
        if (overrideParent == null || !overrideParent.isTextual()) {
            return true;
        }
        JsonNode baseParent = base.get("parent");
        if (baseParent == null || !baseParent.isTextual()) {
            return false;
        }
        try {
            return scope.resolver().parse(baseParent.asText()).equals(scope.resolver().parse(overrideParent.asText()));
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Comparing malformed parents {} and {}", baseParent, overrideParent);
            return baseParent.asText().equals(overrideParent.asText());
        }
    }
}
