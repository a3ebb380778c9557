package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.model.ItemDefinition;
import dev.badgersnacks.packmigrator.model.PredicateOverride;
import dev.badgersnacks.packmigrator.scanner.AssetShape;
import dev.badgersnacks.packmigrator.scanner.ClassifiedAsset;
import dev.badgersnacks.packmigrator.util.ResourceId;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a legacy item model document into an {@link ItemDefinition}.
 *
 * <p>Only overrides whose predicate holds nothing but {@code custom_model_data} become
 * {@link PredicateOverride}s. Overrides that combine it with other predicates (bow pulling, damage,
 * ...) stay in {@link ItemDefinition#rawOverrides()} only.
 */
public final class ItemDefinitionReader {

    static final String CUSTOM_MODEL_DATA = "custom_model_data";

    private final String defaultNamespace;

    public ItemDefinitionReader(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    /**
     * @throws IOException when an override is malformed; the asset should be skipped
     */
    public ItemDefinition read(ClassifiedAsset asset) throws IOException {
        if (asset.shape() != AssetShape.LEGACY_ITEM_DEFINITION) {
            throw new IllegalArgumentException(asset.path() + " is not a legacy item definition");
        }
        ObjectNode document = (ObjectNode) asset.document();
        ObjectNode base = document.deepCopy();
        base.remove("overrides");
        ArrayNode rawOverrides = (ArrayNode) document.get("overrides").deepCopy();
        List<PredicateOverride> overrides = new ArrayList<>();
        for (int i = 0; i < rawOverrides.size(); i++) {
            JsonNode override = rawOverrides.get(i);
            JsonNode predicate = override.path("predicate");
            if (!predicate.isObject() || !predicate.has(CUSTOM_MODEL_DATA) || predicate.size() != 1) {
                continue;
            }
            int value = integralValue(predicate.get(CUSTOM_MODEL_DATA), asset.path(), i);
            JsonNode model = override.path("model");
            if (!model.isTextual() || model.asText().isBlank()) {
                throw new IOException("Override " + i + " of " + asset.path() + " has no model");
            }
            ResourceId modelId;
            try {
                modelId = ResourceId.parse(model.asText(), defaultNamespace);
            } catch (IllegalArgumentException e) {
                throw new IOException("Override " + i + " of " + asset.path() + ": " + e.getMessage(), e);
            }
            overrides.add(new PredicateOverride(value, modelId, i));
        }
        return new ItemDefinition(asset.path(), asset.location().id(), base, overrides, rawOverrides);
    }

    private static int integralValue(JsonNode value, String path, int index) throws IOException {
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isNumber()) {
            double raw = value.doubleValue();
            if (raw == Math.rint(raw) && raw >= Integer.MIN_VALUE && raw <= Integer.MAX_VALUE) {
                return (int) raw;
            }
        }
        throw new IOException("Override " + index + " of " + path + " has a non-integer custom_model_data: " + value);
    }
}
