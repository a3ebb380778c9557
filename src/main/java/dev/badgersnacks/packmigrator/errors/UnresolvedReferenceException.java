package dev.badgersnacks.packmigrator.errors;

import java.util.List;

/**
 * An identifier does not map to any asset of the tree being checked.
 */
public class UnresolvedReferenceException extends ConversionException {

    private final String reference;

    public UnresolvedReferenceException(String reference, String referencedFrom) {
        super("Unresolved reference " + reference
                        + (referencedFrom == null ? "" : " (referenced from " + referencedFrom + ")"),
                referencedFrom == null ? List.of(reference) : List.of(referencedFrom, reference));
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
