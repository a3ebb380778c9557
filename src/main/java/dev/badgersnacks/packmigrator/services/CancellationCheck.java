package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.errors.ConversionCancelledException;

/**
 * Polled by the core between files. Returning {@code true} aborts the run before anything is
 * finalized.
 */
@FunctionalInterface
public interface CancellationCheck {

    CancellationCheck NEVER = () -> false;

    boolean isCancelled();

    default void throwIfCancelled(String phase) throws ConversionCancelledException {
        if (isCancelled()) {
            throw new ConversionCancelledException(phase);
        }
    }
}
