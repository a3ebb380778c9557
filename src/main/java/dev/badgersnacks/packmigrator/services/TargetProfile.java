package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.persistence.RelocationRule;
import dev.badgersnacks.packmigrator.util.GameVersion;

import java.util.ArrayList;
import java.util.List;

/**
 * Versioned table describing what a target game version expects from a resource pack: its
 * {@code pack_format}, how custom model data is encoded, and where item definitions live.
 */
public final class TargetProfile {

    public static final GameVersion OLDEST_SUPPORTED = new GameVersion(1, 14, 0);
    public static final GameVersion ITEM_DEFINITIONS_INTRODUCED = new GameVersion(1, 21, 4);

    private static final List<FormatRule> RULES = new ArrayList<>();

    static {
        RULES.add(new FormatRule(new GameVersion(1, 21, 7), null, 64));
        RULES.add(new FormatRule(new GameVersion(1, 21, 6), new GameVersion(1, 21, 6, 99), 63));
        RULES.add(new FormatRule(new GameVersion(1, 21, 5), new GameVersion(1, 21, 5, 99), 55));
        RULES.add(new FormatRule(new GameVersion(1, 21, 4), new GameVersion(1, 21, 4, 99), 46));
        RULES.add(new FormatRule(new GameVersion(1, 21, 2), new GameVersion(1, 21, 3, 99), 42));
        RULES.add(new FormatRule(new GameVersion(1, 21, 0), new GameVersion(1, 21, 1, 99), 34));
        RULES.add(new FormatRule(new GameVersion(1, 20, 5), new GameVersion(1, 20, 6, 99), 32));
        RULES.add(new FormatRule(new GameVersion(1, 20, 3), new GameVersion(1, 20, 4, 99), 22));
        RULES.add(new FormatRule(new GameVersion(1, 20, 2), new GameVersion(1, 20, 2, 99), 18));
        RULES.add(new FormatRule(new GameVersion(1, 20, 0), new GameVersion(1, 20, 1, 99), 15));
        RULES.add(new FormatRule(new GameVersion(1, 19, 4), new GameVersion(1, 19, 4, 99), 13));
        RULES.add(new FormatRule(new GameVersion(1, 19, 3), new GameVersion(1, 19, 3, 99), 12));
        RULES.add(new FormatRule(new GameVersion(1, 19, 0), new GameVersion(1, 19, 2, 99), 9));
        RULES.add(new FormatRule(new GameVersion(1, 18, 0), new GameVersion(1, 18, 2, 99), 8));
        RULES.add(new FormatRule(new GameVersion(1, 17, 0), new GameVersion(1, 17, 1, 99), 7));
        RULES.add(new FormatRule(new GameVersion(1, 16, 2), new GameVersion(1, 16, 5, 99), 6));
        RULES.add(new FormatRule(new GameVersion(1, 15, 0), new GameVersion(1, 16, 1, 99), 5));
        RULES.add(new FormatRule(OLDEST_SUPPORTED, new GameVersion(1, 14, 4, 99), 4));
    }

    private final GameVersion version;
    private final int packFormat;

    private TargetProfile(GameVersion version, int packFormat) {
        this.version = version;
        this.packFormat = packFormat;
    }

    public static TargetProfile forVersion(String rawVersion) {
        GameVersion version = GameVersion.parse(rawVersion)
                .orElseThrow(() -> new IllegalArgumentException("Unreadable target version: " + rawVersion));
        return forVersion(version);
    }

    public static TargetProfile forVersion(GameVersion version) {
        for (FormatRule rule : RULES) {
            if (version.compareTo(rule.min) >= 0
                    && (rule.max == null || version.compareTo(rule.max) <= 0)) {
                return new TargetProfile(version, rule.format);
            }
        }
        throw new IllegalArgumentException("Target version " + version + " is older than " + OLDEST_SUPPORTED);
    }

    public GameVersion version() {
        return version;
    }

    public int packFormat() {
        return packFormat;
    }

    public PredicateEncoding defaultEncoding() {
        return version.compareTo(ITEM_DEFINITIONS_INTRODUCED) >= 0
                ? PredicateEncoding.RANGE_DISPATCH
                : PredicateEncoding.PREDICATE;
    }

    /**
     * Relocations the layout of {@code encoding} requires. Legacy predicate packs keep their layout.
     */
    public static List<RelocationRule> layoutFor(PredicateEncoding encoding) {
        if (!encoding.usesItemDefinitions()) {
            return List.of();
        }
        return List.of(new RelocationRule(AssetKind.ITEM_DEFINITION, "models/item", AssetKind.ITEM_DEFINITION.directory()));
    }

    @Override
    public String toString() {
        return version + " (pack_format " + packFormat + ")";
    }

    private static final class FormatRule {
        private final GameVersion min;
        private final GameVersion max;
        private final int format;

        private FormatRule(GameVersion min, GameVersion max, int format) {
            this.min = min;
            this.max = max;
            this.format = format;
        }
    }
}
