package dev.badgersnacks.packmigrator.services;

/**
 * Receives progress from the conversion core. Called synchronously on the converting thread, once
 * per processed file, with {@code completed} never decreasing within one phase.
 */
public interface ProgressSink {

    ProgressSink NONE = new ProgressSink() {
        @Override
        public void report(int completed, int total) {
        }

        @Override
        public void message(String text) {
        }
    };

    void report(int completed, int total);

    /** Announces a new phase; {@code completed} restarts from zero afterwards. */
    void message(String text);
}
