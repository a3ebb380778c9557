package dev.badgersnacks.packmigrator.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.util.ResourceId;

import java.util.List;
import java.util.Objects;

/**
 * Rendering rules of one vanilla item as declared by a legacy item model file.
 *
 * @param sourcePath      pack-relative path of the legacy file
 * @param modelId         identifier of the legacy file as a model, which is also the base model reference
 * @param baseDeclaration the legacy file without its {@code overrides} array
 * @param overrides       custom model data overrides in source order
 * @param rawOverrides    the untouched {@code overrides} array, including entries that are not custom model data
 */
public record ItemDefinition(
        String sourcePath,
        ResourceId modelId,
        ObjectNode baseDeclaration,
        List<PredicateOverride> overrides,
        ArrayNode rawOverrides
) {

    public ItemDefinition {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(baseDeclaration, "baseDeclaration");
        Objects.requireNonNull(rawOverrides, "rawOverrides");
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    /** Item name the definition belongs to, e.g. {@code stick}. */
    public String itemName() {
        return modelId.baseName();
    }

    public String namespace() {
        return modelId.namespace();
    }

    /** Number of raw override entries that are not plain custom model data overrides. */
    public int otherOverrideCount() {
        return rawOverrides.size() - overrides.size();
    }

    public String describe(PredicateOverride override) {
        return sourcePath + "#" + override.pointer();
    }
}
