package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ConversionReport;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a converter hands to the next phase: its report, the assets it generated, which must
 * resolve inside the output tree, and the documents it rewrote.
 */
public record ConversionOutput(ConversionReport report, Set<AssetLocation> generated, Set<String> rewritten) {

    public ConversionOutput {
        Objects.requireNonNull(report, "report");
        generated = generated == null ? Set.of() : Set.copyOf(generated);
        rewritten = rewritten == null ? Set.of() : Set.copyOf(rewritten);
    }

    /** Pack paths whose references this run is answerable for: rewritten and generated documents. */
    public Set<String> writtenDocuments() {
        Set<String> documents = new TreeSet<>(rewritten);
        generated.forEach(location -> documents.add(location.relativePath()));
        return documents;
    }
}
