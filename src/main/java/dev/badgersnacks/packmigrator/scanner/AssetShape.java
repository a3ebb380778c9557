package dev.badgersnacks.packmigrator.scanner;

/**
 * Top-level JSON shape of a classified asset.
 */
public enum AssetShape {
    /** Vanilla item model with custom model data {@code overrides}. */
    LEGACY_ITEM_DEFINITION(true),
    /** Document with a top-level {@code model} object, wherever it lives. */
    ITEM_DEFINITION(true),
    /** Plain model without overrides. */
    MODEL(false);

    private final boolean itemDefinition;

    AssetShape(boolean itemDefinition) {
        this.itemDefinition = itemDefinition;
    }

    public boolean isItemDefinition() {
        return itemDefinition;
    }
}
