package dev.badgersnacks.packmigrator.util;

import java.util.Locale;
import java.util.Objects;

/**
 * Simple namespace:path identifier used for every asset reference inside a resource pack.
 */
public record ResourceId(String namespace, String path) implements Comparable<ResourceId> {
    public static final String DEFAULT_NAMESPACE = "minecraft";

    public ResourceId {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(path, "path");
        if (namespace.isBlank() || path.isBlank()) {
            throw new IllegalArgumentException("Invalid resource id: " + namespace + ":" + path);
        }
    }

    public static ResourceId of(String namespace, String path) {
        return new ResourceId(namespace, path);
    }

    public static ResourceId parse(String id) {
        return parse(id, DEFAULT_NAMESPACE);
    }

    /**
     * Parses {@code namespace:path} or a bare {@code path}, which takes {@code defaultNamespace}.
     * Identifiers are lower-cased the same way the game normalizes them.
     */
    public static ResourceId parse(String id, String defaultNamespace) {
        Objects.requireNonNull(id, "id");
        String trimmed = id.trim();
        int idx = trimmed.indexOf(':');
        if (idx == trimmed.length() - 1 || trimmed.isEmpty()) {
            throw new IllegalArgumentException("Invalid resource id: " + id);
        }
        if (idx < 0) {
            return new ResourceId(defaultNamespace, trimmed.toLowerCase(Locale.ROOT));
        }
        String namespace = idx == 0 ? defaultNamespace : trimmed.substring(0, idx);
        return new ResourceId(namespace.toLowerCase(Locale.ROOT),
                trimmed.substring(idx + 1).toLowerCase(Locale.ROOT));
    }

    /** Last path segment, e.g. {@code stick} for {@code minecraft:item/stick}. */
    public String baseName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    public ResourceId withPath(String newPath) {
        return new ResourceId(namespace, newPath);
    }

    public String asString() {
        return namespace + ":" + path;
    }

    @Override
    public int compareTo(ResourceId other) {
        int byNamespace = namespace.compareTo(other.namespace);
        return byNamespace != 0 ? byNamespace : path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return asString();
    }
}
