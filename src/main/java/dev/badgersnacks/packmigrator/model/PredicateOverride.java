package dev.badgersnacks.packmigrator.model;

import dev.badgersnacks.packmigrator.util.ResourceId;

import java.util.Objects;

/**
 * One legacy {@code overrides} entry whose only predicate is {@code custom_model_data}.
 *
 * @param index position of the entry in the source {@code overrides} array
 */
public record PredicateOverride(int customModelDataValue, ResourceId modelReference, int index) {

    public PredicateOverride {
        Objects.requireNonNull(modelReference, "modelReference");
    }

    /** JSON pointer of the entry inside its source file, used in error messages. */
    public String pointer() {
        return "/overrides/" + index;
    }
}
