package dev.badgersnacks.packmigrator.util;

import java.util.Optional;

/**
 * Release version of the game, compared numerically part by part.
 */
public final class GameVersion implements Comparable<GameVersion> {
    private final int major;
    private final int minor;
    private final int patch;
    private final int build;

    public GameVersion(int major, int minor, int patch) {
        this(major, minor, patch, 0);
    }

    public GameVersion(int major, int minor, int patch, int build) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.build = build;
    }

    public static Optional<GameVersion> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = raw.trim();
        StringBuilder digits = new StringBuilder();
        for (char c : cleaned.toCharArray()) {
            if (Character.isDigit(c) || c == '.') {
                digits.append(c);
            } else {
                break;
            }
        }
        if (digits.length() == 0) {
            return Optional.empty();
        }
        String[] parts = digits.toString().split("\\.");
        int major = parsePart(parts, 0);
        int minor = parsePart(parts, 1);
        int patch = parsePart(parts, 2);
        return Optional.of(new GameVersion(major, minor, patch));
    }

    private static int parsePart(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public int compareTo(GameVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        if (patch != other.patch) {
            return Integer.compare(patch, other.patch);
        }
        return Integer.compare(build, other.build);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GameVersion other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return ((major * 31 + minor) * 31 + patch) * 31 + build;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch + (build > 0 ? "." + build : "");
    }
}
