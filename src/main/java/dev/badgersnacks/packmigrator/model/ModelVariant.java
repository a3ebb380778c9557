package dev.badgersnacks.packmigrator.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.util.ResourceId;

import java.util.Objects;

/**
 * A generated standalone model for one custom model data case, or for the base case.
 *
 * @param discriminator custom model data value, or {@code null} for the base variant
 * @param source        where the variant came from, e.g. {@code assets/minecraft/models/item/stick.json#/overrides/0}
 */
public record ModelVariant(ResourceId id, Integer discriminator, ObjectNode model, String source) {

    public ModelVariant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(source, "source");
    }

    public boolean isBase() {
        return discriminator == null;
    }

    public AssetLocation location() {
        return new AssetLocation(AssetKind.MODEL, id);
    }
}
