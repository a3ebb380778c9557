package dev.badgersnacks.packmigrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters describing one conversion run. Immutable once {@link Builder#build()} is called.
 */
public record ConversionReport(
        int filesScanned,
        int filesRewritten,
        int variantsGenerated,
        int filesSkipped,
        List<ParseFailure> parseFailures
) {

    public ConversionReport {
        parseFailures = parseFailures == null ? List.of() : List.copyOf(parseFailures);
    }

    public static ConversionReport empty() {
        return new ConversionReport(0, 0, 0, 0, List.of());
    }

    public boolean hasParseFailures() {
        return !parseFailures.isEmpty();
    }

    public String summary() {
        return String.format("scanned=%d rewritten=%d variants=%d skipped=%d parseFailures=%d",
                filesScanned, filesRewritten, variantsGenerated, filesSkipped, parseFailures.size());
    }

    /**
     * Append-only accumulator used while a run is in progress.
     */
    public static final class Builder {
        private int filesScanned;
        private int filesRewritten;
        private int variantsGenerated;
        private int filesSkipped;
        private final List<ParseFailure> parseFailures = new ArrayList<>();

        public Builder scanned(int count) {
            filesScanned += count;
            return this;
        }

        public Builder rewritten() {
            filesRewritten++;
            return this;
        }

        public Builder variants(int count) {
            variantsGenerated += count;
            return this;
        }

        public Builder skipped(int count) {
            filesSkipped += count;
            return this;
        }

        public Builder parseFailure(ParseFailure failure) {
            parseFailures.add(failure);
            return this;
        }

        public ConversionReport build() {
            return new ConversionReport(filesScanned, filesRewritten, variantsGenerated, filesSkipped, parseFailures);
        }
    }
}
