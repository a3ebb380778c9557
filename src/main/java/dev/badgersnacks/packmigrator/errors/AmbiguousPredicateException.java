package dev.badgersnacks.packmigrator.errors;

import java.util.List;

/**
 * Two overrides of one item definition use the same custom model data value.
 */
public class AmbiguousPredicateException extends ConversionException {

    public AmbiguousPredicateException(int value, String firstLocation, String secondLocation) {
        this("Custom model data " + value + " is declared twice: " + firstLocation + " and " + secondLocation,
                firstLocation, secondLocation);
    }

    protected AmbiguousPredicateException(String message, String firstLocation, String secondLocation) {
        super(message, List.of(firstLocation, secondLocation));
    }
}
