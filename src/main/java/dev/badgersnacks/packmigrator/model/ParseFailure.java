package dev.badgersnacks.packmigrator.model;

/**
 * A single asset that could not be read. Recorded and skipped, never fatal for the run.
 */
public record ParseFailure(String path, String message) {
}
