package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.core.JsonPointer;
import dev.badgersnacks.packmigrator.model.AssetLocation;

import java.util.Objects;

/**
 * One identifier found inside a JSON document.
 *
 * @param documentPath pack path of the document holding the identifier
 * @param pointer      location of the string value inside the document
 * @param target       asset the identifier addresses
 */
public record Reference(String documentPath, JsonPointer pointer, AssetLocation target) {

    public Reference {
        Objects.requireNonNull(documentPath, "documentPath");
        Objects.requireNonNull(pointer, "pointer");
        Objects.requireNonNull(target, "target");
    }

    public String describe() {
        return documentPath + "#" + pointer;
    }
}
