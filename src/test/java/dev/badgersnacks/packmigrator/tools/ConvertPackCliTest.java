package dev.badgersnacks.packmigrator.tools;

import dev.badgersnacks.packmigrator.TestPacks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConvertPackCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void convertsAPackIntoTheOutputFolder() throws IOException {
        Path input = TestPacks.stickPack(tempDir.resolve("input"));
        Path output = tempDir.resolve("output");

        int code = run("cmd", input.toString(), output.toString());

        assertEquals(ConvertPackCli.EXIT_OK, code, err.toString(StandardCharsets.UTF_8));
        try (Stream<Path> archives = Files.list(output)) {
            assertTrue(archives.anyMatch(path -> path.getFileName().toString().matches("converted_\\d{8}_\\d{6}\\.zip")));
        }
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Archive written to"));
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(ConvertPackCli.EXIT_USAGE, run("cmd"));
        assertEquals(ConvertPackCli.EXIT_USAGE, run("bogus", tempDir.toString(), tempDir.toString()));
        assertEquals(ConvertPackCli.EXIT_USAGE, run("cmd", tempDir.resolve("absent").toString(), tempDir.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: ConvertPackCli"));
    }

    @Test
    void conversionFailuresExitWithTwo() throws IOException {
        Path input = tempDir.resolve("input");
        TestPacks.write(input, "assets/minecraft/models/item/stick.json", """
                {"overrides": [
                  {"predicate": {"custom_model_data": 1}, "model": "item/a"},
                  {"predicate": {"custom_model_data": 1}, "model": "item/b"}
                ]}
                """);
        Path settings = TestPacks.write(tempDir, "settings.json", "{\"targetVersion\": \"1.21.5\"}");

        int code = run("item-model", input.toString(), tempDir.resolve("output").toString(), settings.toString());

        assertEquals(ConvertPackCli.EXIT_FAILURE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Conversion failed"));
    }

    private int run(String... args) {
        return ConvertPackCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                tempDir.resolve("logs"));
    }
}
