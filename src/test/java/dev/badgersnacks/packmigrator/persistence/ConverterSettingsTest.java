package dev.badgersnacks.packmigrator.persistence;

import dev.badgersnacks.packmigrator.TestPacks;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConverterSettingsTest {

    @TempDir
    Path tempDir;

    private final ConverterSettings settings = new ConverterSettings();

    @Test
    void readsEveryKey() throws IOException {
        Path file = TestPacks.write(tempDir, "settings.json", """
                {
                  "targetVersion": "1.21.5",
                  "predicateEncoding": "SELECT",
                  "defaultNamespace": "custom",
                  "builtInNamespaces": ["minecraft", "realms"],
                  "excludedDirectories": [".git", "drafts"],
                  "relocations": [{"kind": "MODEL", "from": "/models/old/", "to": "models/new"}],
                  "unknownKey": true
                }
                """);

        ConverterOptions options = settings.load(file);

        assertEquals("1.21.5", options.targetVersion());
        assertEquals(55, options.profile().packFormat());
        assertEquals(PredicateEncoding.SELECT, options.encoding());
        assertEquals("custom", options.defaultNamespace());
        assertTrue(options.isBuiltIn("realms"));
        assertTrue(options.isExcludedDirectory("drafts"));
        assertEquals(List.of(new RelocationRule(AssetKind.MODEL, "models/old", "models/new")), options.relocations());
        assertEquals(2, options.layout().size());
    }

    @Test
    void missingFileGivesDefaults() {
        assertEquals(ConverterOptions.defaults(), settings.load(tempDir.resolve("absent.json")));
        assertEquals(ConverterOptions.defaults(), settings.load(null));
    }

    @Test
    void malformedFilesFallBackToDefaults() throws IOException {
        Path broken = TestPacks.write(tempDir, "broken.json", "{ \"targetVersion\": ");
        assertEquals(ConverterOptions.defaults(), settings.load(broken));

        Path tooOld = TestPacks.write(tempDir, "old.json", "{\"targetVersion\": \"1.8.9\"}");
        assertEquals(ConverterOptions.defaults(), settings.load(tooOld));
    }

    @Test
    void defaultsTargetItemDefinitions() {
        ConverterOptions options = ConverterOptions.defaults();
        assertEquals("1.21.4", options.targetVersion());
        assertEquals(PredicateEncoding.RANGE_DISPATCH, options.encoding());
        assertTrue(options.isExcludedDirectory(".git"));
    }
}
