package dev.badgersnacks.packmigrator.agents;

import dev.badgersnacks.packmigrator.TestPacks;
import dev.badgersnacks.packmigrator.errors.ConversionCancelledException;
import dev.badgersnacks.packmigrator.model.ConversionMode;
import dev.badgersnacks.packmigrator.model.ConversionResult;
import dev.badgersnacks.packmigrator.services.ConversionContext;
import dev.badgersnacks.packmigrator.services.ResourcePackConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionWorkerTest {

    @TempDir
    Path tempDir;

    @Test
    void runsConversionsInTheBackground() throws Exception {
        Path input = TestPacks.stickPack(tempDir.resolve("input"));
        Path output = Files.createDirectories(tempDir.resolve("output"));
        PackConversionJob job = new PackConversionJob(input, output, ConversionMode.ITEM_MODEL,
                LocalDateTime.of(2025, 6, 1, 10, 0), new ResourcePackConverter());

        try (ConversionWorker worker = new ConversionWorker(1)) {
            ConversionHandle<ConversionResult> handle = worker.submit(job, ConversionContext.defaults());
            JobResult<ConversionResult> result = handle.result().get(30, TimeUnit.SECONDS);

            assertEquals("convert-item-model", result.jobName());
            assertTrue(Files.exists(result.payload().archive()));
            assertEquals(3, result.payload().report().variantsGenerated());
        }
    }

    @Test
    void cancelStopsTheJobAtItsNextCheckpoint() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        ConversionJob<String> job = new ConversionJob<>() {
            @Override
            public String name() {
                return "blocking";
            }

            @Override
            public String run(ConversionContext context) throws Exception {
                started.countDown();
                assertTrue(cancelled.await(30, TimeUnit.SECONDS));
                context.checkpoint("blocking", 1, 1);
                return "finished";
            }
        };

        try (ConversionWorker worker = new ConversionWorker(1)) {
            ConversionHandle<String> handle = worker.submit(job, ConversionContext.defaults());
            assertTrue(started.await(30, TimeUnit.SECONDS));
            handle.cancel();
            cancelled.countDown();

            ExecutionException error = assertThrows(ExecutionException.class,
                    () -> handle.result().get(30, TimeUnit.SECONDS));
            assertTrue(error.getCause() instanceof ConversionCancelledException);
            assertTrue(handle.isCancelled());
        }
    }

    @Test
    void workerThreadsAreDaemons() throws Exception {
        ConversionJob<Boolean> job = new ConversionJob<>() {
            @Override
            public String name() {
                return "daemon-check";
            }

            @Override
            public Boolean run(ConversionContext context) {
                return Thread.currentThread().isDaemon();
            }
        };

        try (ConversionWorker worker = new ConversionWorker(1)) {
            JobResult<Boolean> result = worker.submit(job, ConversionContext.defaults()).result().get(30, TimeUnit.SECONDS);
            assertTrue(result.payload());
            assertNotNull(result.duration());
        }
    }
}
