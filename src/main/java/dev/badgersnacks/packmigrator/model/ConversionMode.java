package dev.badgersnacks.packmigrator.model;

import java.util.Locale;

public enum ConversionMode {
    CUSTOM_MODEL_DATA("cmd", "Custom Model Data"),
    ITEM_MODEL("item-model", "Item Model");

    private final String argument;
    private final String label;

    ConversionMode(String argument, String label) {
        this.argument = argument;
        this.label = label;
    }

    public String argument() {
        return argument;
    }

    public static ConversionMode fromArgument(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (ConversionMode mode : values()) {
                if (mode.argument.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown conversion mode: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
