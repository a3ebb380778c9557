package dev.badgersnacks.packmigrator.agents;

import java.time.Duration;

/**
 * Value of a finished job together with how long it took.
 */
public record JobResult<T>(String jobName, T payload, Duration duration) {
}
