package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.errors.ConversionCancelledException;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;

import java.util.Objects;

/**
 * Everything a conversion call needs from its caller. Passed explicitly to every entry point so
 * concurrent runs never share settings.
 */
public record ConversionContext(ConverterOptions options, ProgressSink progress, CancellationCheck cancellation) {

    public ConversionContext {
        Objects.requireNonNull(options, "options");
        progress = progress == null ? ProgressSink.NONE : progress;
        cancellation = cancellation == null ? CancellationCheck.NEVER : cancellation;
    }

    public static ConversionContext defaults() {
        return new ConversionContext(ConverterOptions.defaults(), ProgressSink.NONE, CancellationCheck.NEVER);
    }

    public static ConversionContext of(ConverterOptions options) {
        return new ConversionContext(options, ProgressSink.NONE, CancellationCheck.NEVER);
    }

    public ConversionContext withProgress(ProgressSink sink) {
        return new ConversionContext(options, sink, cancellation);
    }

    public ConversionContext withCancellation(CancellationCheck check) {
        return new ConversionContext(options, progress, check);
    }

    /** Reports {@code completed/total} and then polls cancellation, the per-file checkpoint. */
    public void checkpoint(String phase, int completed, int total) throws ConversionCancelledException {
        progress.report(completed, total);
        cancellation.throwIfCancelled(phase);
    }
}
