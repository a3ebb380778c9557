package dev.badgersnacks.packmigrator.agents;

import dev.badgersnacks.packmigrator.services.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor facade that keeps conversions off the caller's thread.
 */
public class ConversionWorker implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionWorker.class);

    private final ExecutorService executorService;

    public ConversionWorker() {
        this(Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
    }

    public ConversionWorker(int threads) {
        this.executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * Schedules {@code job}. The context's own cancellation check still applies, alongside the
     * returned handle's {@link ConversionHandle#cancel()}.
     */
    public <T> ConversionHandle<T> submit(ConversionJob<T> job, ConversionContext context) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(context, "context");
        AtomicBoolean cancelled = new AtomicBoolean();
        ConversionContext jobContext = context.withCancellation(
                () -> cancelled.get() || context.cancellation().isCancelled());
        CompletableFuture<JobResult<T>> future =
                CompletableFuture.supplyAsync(() -> execute(job, jobContext), executorService);
        return new ConversionHandle<>(cancelled, future);
    }

    private <T> JobResult<T> execute(ConversionJob<T> job, ConversionContext context) {
        Instant start = Instant.now();
        try {
            T payload = job.run(context);
            Duration duration = Duration.between(start, Instant.now());
            LOGGER.info("Job {} finished in {} ms", job.name(), duration.toMillis());
            return new JobResult<>(job.name(), payload, duration);
        } catch (Exception e) {
            LOGGER.warn("Job {} failed: {}", job.name(), e.getMessage());
            throw new CompletionException(e);
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "conversion-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
