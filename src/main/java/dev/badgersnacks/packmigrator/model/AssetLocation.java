package dev.badgersnacks.packmigrator.model;

import dev.badgersnacks.packmigrator.util.ResourceId;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Binds an identifier to the asset family it addresses, which fixes its file path inside a pack.
 */
public record AssetLocation(AssetKind kind, ResourceId id) implements Comparable<AssetLocation> {

    public AssetLocation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    /** Forward-slash path relative to the pack root, e.g. {@code assets/minecraft/models/item/stick.json}. */
    public String relativePath() {
        return "assets/" + id.namespace() + "/" + kind.directory() + "/" + id.path() + kind.extension();
    }

    /**
     * Inverse of {@link #relativePath()}. Returns empty for paths outside {@code assets/<ns>/<kind>/}.
     */
    public static Optional<AssetLocation> fromRelativePath(String relativePath) {
        if (relativePath == null) {
            return Optional.empty();
        }
        String[] parts = relativePath.split("/", 4);
        if (parts.length < 4 || !"assets".equals(parts[0]) || parts[1].isEmpty()) {
            return Optional.empty();
        }
        for (AssetKind kind : AssetKind.values()) {
            if (kind.directory().equals(parts[2]) && parts[3].endsWith(kind.extension())) {
                String path = parts[3].substring(0, parts[3].length() - kind.extension().length());
                if (path.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new AssetLocation(kind, ResourceId.of(parts[1], path)));
            }
        }
        return Optional.empty();
    }

    @Override
    public int compareTo(AssetLocation other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + " " + id.asString();
    }
}
