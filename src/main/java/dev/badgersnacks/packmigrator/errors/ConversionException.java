package dev.badgersnacks.packmigrator.errors;

import java.io.IOException;
import java.util.List;

/**
 * Fatal problem that terminates a conversion run. Carries the pack paths or identifiers involved
 * so the caller can show them.
 */
public class ConversionException extends IOException {

    private final List<String> locations;

    public ConversionException(String message, List<String> locations) {
        super(message);
        this.locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public ConversionException(String message, List<String> locations, Throwable cause) {
        super(message, cause);
        this.locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public List<String> locations() {
        return locations;
    }
}
