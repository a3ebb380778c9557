package dev.badgersnacks.packmigrator.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.badgersnacks.packmigrator.model.AssetKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Moves assets of one kind from a directory to another inside every namespace. Directories are
 * relative to {@code assets/<namespace>/}, e.g. {@code models/item} to {@code items}.
 */
public record RelocationRule(
        @JsonProperty("kind") AssetKind kind,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to) {

    public RelocationRule {
        Objects.requireNonNull(kind, "kind");
        from = trimSlashes(Objects.requireNonNull(from, "from"));
        to = trimSlashes(Objects.requireNonNull(to, "to"));
        if (from.isEmpty() || to.isEmpty()) {
            throw new IllegalArgumentException("Relocation directories must not be empty");
        }
    }

    /**
     * Target path for {@code relativePath}, or empty when the rule does not cover it.
     */
    public Optional<String> relocate(String relativePath) {
        String[] parts = relativePath.split("/", 3);
        if (parts.length < 3 || !"assets".equals(parts[0])) {
            return Optional.empty();
        }
        String prefix = from + "/";
        if (!parts[2].startsWith(prefix)) {
            return Optional.empty();
        }
        String remainder = parts[2].substring(prefix.length());
        return Optional.of("assets/" + parts[1] + "/" + to + "/" + remainder);
    }

    private static String trimSlashes(String value) {
        String trimmed = value.trim().replace('\\', '/');
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
