package dev.badgersnacks.packmigrator.model;

/**
 * How a custom model data value is expressed by the target game version.
 */
public enum PredicateEncoding {
    /** Legacy {@code overrides} entry with {@code predicate.custom_model_data}. */
    PREDICATE,
    /** {@code minecraft:range_dispatch} entry keyed by a float threshold. */
    RANGE_DISPATCH,
    /** {@code minecraft:select} case keyed by the value as a string; matches string custom model data only. */
    SELECT;

    public boolean usesItemDefinitions() {
        return this != PREDICATE;
    }
}
