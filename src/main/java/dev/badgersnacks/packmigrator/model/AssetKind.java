package dev.badgersnacks.packmigrator.model;

/**
 * Asset families a resource pack addresses through {@code namespace:path} identifiers.
 */
public enum AssetKind {
    MODEL("models", ".json"),
    ITEM_DEFINITION("items", ".json"),
    TEXTURE("textures", ".png");

    private final String directory;
    private final String extension;

    AssetKind(String directory, String extension) {
        this.directory = directory;
        this.extension = extension;
    }

    public String directory() {
        return directory;
    }

    public String extension() {
        return extension;
    }
}
