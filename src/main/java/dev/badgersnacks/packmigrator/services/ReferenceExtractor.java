package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.util.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finds and rewrites the identifiers that model and item definition documents hold.
 *
 * <p>Recognized references: model {@code parent} (except {@code builtin/*}), {@code textures}
 * values (except {@code #variable} links), legacy {@code overrides[].model}, and inside a
 * {@code model} tree every {@code minecraft:model} {@code model} and {@code minecraft:special}
 * {@code base}.
 */
public final class ReferenceExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceExtractor.class);

    private final String defaultNamespace;

    public ReferenceExtractor(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public List<Reference> extract(String documentPath, JsonNode document) {
        List<Reference> references = new ArrayList<>();
        if (document == null || !document.isObject()) {
            return references;
        }
        JsonNode parent = document.path("parent");
        if (parent.isTextual() && !parent.asText().startsWith("builtin/")) {
            add(references, documentPath, "/parent", AssetKind.MODEL, parent.asText());
        }
        JsonNode textures = document.path("textures");
        if (textures.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = textures.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String value = field.getValue().asText("");
                if (field.getValue().isTextual() && !value.startsWith("#")) {
                    add(references, documentPath, "/textures/" + escape(field.getKey()), AssetKind.TEXTURE, value);
                }
            }
        }
        JsonNode overrides = document.path("overrides");
        if (overrides.isArray()) {
            for (int i = 0; i < overrides.size(); i++) {
                JsonNode model = overrides.get(i).path("model");
                if (model.isTextual()) {
                    add(references, documentPath, "/overrides/" + i + "/model", AssetKind.MODEL, model.asText());
                }
            }
        }
        JsonNode itemModel = document.path("model");
        if (itemModel.isContainerNode()) {
            collectItemModel(references, documentPath, "/model", itemModel);
        }
        return references;
    }

    /**
     * Replaces the identifier at {@code reference.pointer()} in {@code document} with {@code target}.
     */
    public void rewrite(ObjectNode document, Reference reference, ResourceId target) {
        JsonPointer pointer = reference.pointer();
        JsonNode container = document.at(pointer.head());
        String field = pointer.last().getMatchingProperty();
        if (!container.isObject() || !container.has(field)) {
            throw new IllegalStateException("Reference " + reference.describe() + " no longer exists");
        }
        ((ObjectNode) container).put(field, target.asString());
    }

    private void collectItemModel(List<Reference> sink, String documentPath, String pointer, JsonNode node) {
        if (node.isObject()) {
            String type = normalizeType(node.path("type").asText(""));
            if ("minecraft:model".equals(type) && node.path("model").isTextual()) {
                add(sink, documentPath, pointer + "/model", AssetKind.MODEL, node.path("model").asText());
            } else if ("minecraft:special".equals(type) && node.path("base").isTextual()) {
                add(sink, documentPath, pointer + "/base", AssetKind.MODEL, node.path("base").asText());
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isContainerNode()) {
                    collectItemModel(sink, documentPath, pointer + "/" + escape(field.getKey()), field.getValue());
                }
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collectItemModel(sink, documentPath, pointer + "/" + i, node.get(i));
            }
        }
    }

    private void add(List<Reference> sink, String documentPath, String pointer, AssetKind kind, String raw) {
        try {
            ResourceId id = ResourceId.parse(raw, defaultNamespace);
            sink.add(new Reference(documentPath, JsonPointer.compile(pointer), new AssetLocation(kind, id)));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Ignoring malformed identifier '{}' at {}#{}", raw, documentPath, pointer);
        }
    }

    private static String normalizeType(String type) {
        return type.indexOf(':') < 0 ? "minecraft:" + type : type;
    }

    private static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
}
