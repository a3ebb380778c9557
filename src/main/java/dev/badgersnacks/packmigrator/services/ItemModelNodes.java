package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.util.ResourceId;

/**
 * Builders for the item model trees used by item definitions.
 *
 * <p>{@code range_dispatch} reads the first entry of the item's custom model data {@code floats},
 * which is where the game puts a legacy integer value. {@code select} compares {@code when} against
 * the {@code strings} list instead, so its cases only fire for items given string custom model data.
 */
final class ItemModelNodes {

    static final String CUSTOM_MODEL_DATA_PROPERTY = "minecraft:custom_model_data";

    private ItemModelNodes() {
    }

    /** {@code {"type": "minecraft:model", "model": id}} */
    static ObjectNode plainModel(ResourceId model) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", "minecraft:model");
        node.put("model", model.asString());
        return node;
    }

    static ObjectNode rangeDispatch(ResourceId fallback) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", "minecraft:range_dispatch");
        node.put("property", CUSTOM_MODEL_DATA_PROPERTY);
        node.putArray("entries");
        node.set("fallback", plainModel(fallback));
        return node;
    }

    static void addThreshold(ObjectNode rangeDispatch, int threshold, ResourceId model) {
        ObjectNode entry = ((ArrayNode) rangeDispatch.get("entries")).addObject();
        entry.put("threshold", threshold);
        entry.set("model", plainModel(model));
    }

    static ObjectNode select(ResourceId fallback) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", "minecraft:select");
        node.put("property", CUSTOM_MODEL_DATA_PROPERTY);
        node.putArray("cases");
        node.set("fallback", plainModel(fallback));
        return node;
    }

    static void addCase(ObjectNode select, int value, ResourceId model) {
        ObjectNode entry = ((ArrayNode) select.get("cases")).addObject();
        entry.put("when", Integer.toString(value));
        entry.set("model", plainModel(model));
    }

    /** Item definition document wrapping {@code model}. */
    static ObjectNode definition(ObjectNode model) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.set("model", model);
        return root;
    }
}
