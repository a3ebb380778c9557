package dev.badgersnacks.packmigrator.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.packmigrator.model.AssetLocation;

import java.util.Objects;

public record ClassifiedAsset(String path, AssetLocation location, AssetShape shape, JsonNode document) {

    public ClassifiedAsset {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(document, "document");
    }
}
