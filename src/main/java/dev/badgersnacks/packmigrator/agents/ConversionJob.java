package dev.badgersnacks.packmigrator.agents;

import dev.badgersnacks.packmigrator.services.ConversionContext;

/**
 * Unit of work the {@link ConversionWorker} runs off the caller's thread. The context handed to
 * {@link #run(ConversionContext)} carries the cancellation flag of the job's handle.
 */
public interface ConversionJob<T> {
    String name();

    T run(ConversionContext context) throws Exception;
}
