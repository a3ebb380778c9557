package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Points {@code pack.mcmeta} at the resource pack format of the target version.
 */
public class PackMetaRewriter {

    public static final String PACK_META = "pack.mcmeta";
    private static final Logger LOGGER = LoggerFactory.getLogger(PackMetaRewriter.class);

    /**
     * @return true when the file was changed
     */
    public boolean rewrite(ResourceTree tree, TargetProfile profile) {
        if (!tree.contains(PACK_META)) {
            LOGGER.warn("No {} in pack, the game will not list it", PACK_META);
            return false;
        }
        JsonNode meta;
        try {
            meta = tree.readJson(PACK_META);
        } catch (IOException e) {
            LOGGER.warn("Leaving unreadable {} untouched: {}", PACK_META, e.getMessage());
            return false;
        }
        JsonNode pack = meta.path("pack");
        if (!pack.isObject()) {
            LOGGER.warn("{} has no pack section, leaving it untouched", PACK_META);
            return false;
        }
        int existingFormat = pack.path("pack_format").asInt(-1);
        if (existingFormat == profile.packFormat()) {
            return false;
        }
        ObjectNode updated = ((ObjectNode) meta).deepCopy();
        ((ObjectNode) updated.get("pack")).put("pack_format", profile.packFormat());
        tree.putDocument(PACK_META, updated);
        LOGGER.info("Updated pack_format {} -> {} for {}", existingFormat, profile.packFormat(), profile);
        return true;
    }
}
