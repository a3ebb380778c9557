package dev.badgersnacks.packmigrator.errors;

import dev.badgersnacks.packmigrator.util.ResourceId;

/**
 * Two sources would produce the same generated model identifier.
 */
public class DuplicateVariantException extends AmbiguousPredicateException {

    private final ResourceId variantId;

    public DuplicateVariantException(ResourceId variantId, String firstLocation, String secondLocation) {
        super("Generated model " + variantId.asString() + " collides: " + firstLocation + " and " + secondLocation,
                firstLocation, secondLocation);
        this.variantId = variantId;
    }

    public ResourceId variantId() {
        return variantId;
    }
}
