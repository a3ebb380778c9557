package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.packmigrator.TestPacks;
import dev.badgersnacks.packmigrator.errors.ConversionException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.RelocationRule;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.util.ResourceId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolderStructureNormalizerTest {

    @TempDir
    Path tempDir;

    private final FolderStructureNormalizer normalizer = new FolderStructureNormalizer();

    @Test
    void splitsHybridDefinitionsIntoTheItemsFolder() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"parent": "item/generated", "textures": {"layer0": "item/stick"},
                 "model": {"type": "minecraft:model", "model": "minecraft:item/stick"}}
                """);
        ResourceTree tree = load(ConverterOptions.defaults());

        Set<AssetLocation> relocated = normalizer.normalize(tree, ConversionContext.defaults());

        assertEquals(Set.of(new AssetLocation(AssetKind.ITEM_DEFINITION, ResourceId.parse("stick"))), relocated);
        JsonNode definition = tree.readJson("assets/minecraft/items/stick.json");
        assertEquals(1, definition.size());
        assertEquals("minecraft:item/stick", definition.path("model").path("model").asText());
        JsonNode declaration = tree.readJson("assets/minecraft/models/item/stick.json");
        assertFalse(declaration.has("model"));
        assertEquals("item/generated", declaration.path("parent").asText());
    }

    @Test
    void removesDeclarationsLeftEmpty() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"model": {"type": "minecraft:model", "model": "minecraft:item/stick"}}
                """);
        ResourceTree tree = load(ConverterOptions.defaults());

        normalizer.normalize(tree, ConversionContext.defaults());

        assertFalse(tree.contains("assets/minecraft/models/item/stick.json"));
        assertTrue(tree.removedPaths().contains("assets/minecraft/models/item/stick.json"));
        assertTrue(tree.contains("assets/minecraft/items/stick.json"));
    }

    @Test
    void legacyItemModelsWithoutItemModelTreesStayInPlace() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/bow.json", """
                {"parent": "item/generated", "overrides": [
                  {"predicate": {"pulling": 1}, "model": "item/bow_pulling_0"}
                ]}
                """);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"parent": "item/generated", "model": {"type": "minecraft:model", "model": "minecraft:item/stick"}}
                """);
        ResourceTree tree = load(ConverterOptions.defaults());

        Set<AssetLocation> relocated = normalizer.normalize(tree, ConversionContext.defaults());

        assertEquals(Set.of(new AssetLocation(AssetKind.ITEM_DEFINITION, ResourceId.parse("stick"))), relocated);
        assertFalse(tree.contains("assets/minecraft/items/bow.json"));
        assertFalse(tree.changedPaths().contains("assets/minecraft/models/item/bow.json"));
        assertFalse(tree.removedPaths().contains("assets/minecraft/models/item/bow.json"));
    }

    @Test
    void configuredModelRelocationsRewriteReferences() throws IOException {
        TestPacks.write(tempDir, "assets/custom/models/item/custom/gem.json", """
                {"parent": "item/generated", "textures": {"layer0": "custom:item/custom/gem"}}
                """);
        TestPacks.write(tempDir, "assets/custom/models/item/ring.json", """
                {"parent": "custom:item/custom/gem"}
                """);
        TestPacks.write(tempDir, "assets/custom/textures/item/custom/gem.png", "png");
        ConverterOptions options = ConverterOptions.defaults()
                .withPredicateEncoding(PredicateEncoding.PREDICATE)
                .withRelocations(List.of(new RelocationRule(AssetKind.MODEL, "models/item/custom", "models/gems")));
        ResourceTree tree = load(options);

        Set<AssetLocation> relocated = normalizer.normalize(tree, ConversionContext.of(options));

        assertTrue(relocated.contains(new AssetLocation(AssetKind.MODEL, ResourceId.parse("custom:gems/gem"))));
        assertFalse(tree.contains("assets/custom/models/item/custom/gem.json"));
        assertTrue(tree.contains("assets/custom/models/gems/gem.json"));
        assertEquals("custom:gems/gem", tree.readJson("assets/custom/models/item/ring.json").path("parent").asText());
        new ReferenceValidator().validate(tree, options, relocated, tree.changedPaths());
    }

    @Test
    void predicateLayoutLeavesTheTreeAlone() throws IOException {
        TestPacks.stickPack(tempDir);
        ConverterOptions options = ConverterOptions.defaults().withTargetVersion("1.20.4");
        ResourceTree tree = load(options);

        assertTrue(normalizer.normalize(tree, ConversionContext.of(options)).isEmpty());
        assertTrue(tree.changedPaths().isEmpty());
    }

    @Test
    void normalizedTreesStayUnchanged() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/items/stick.json", """
                {"model": {"type": "minecraft:model", "model": "minecraft:item/stick"}}
                """);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", "{\"parent\": \"item/generated\"}");
        ResourceTree tree = load(ConverterOptions.defaults());

        assertTrue(normalizer.normalize(tree, ConversionContext.defaults()).isEmpty());
        assertTrue(tree.changedPaths().isEmpty());
        assertTrue(tree.removedPaths().isEmpty());
    }

    @Test
    void refusesToOverwriteAnExistingDefinition() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/items/stick.json", """
                {"model": {"type": "minecraft:model", "model": "minecraft:item/other"}}
                """);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"model": {"type": "minecraft:model", "model": "minecraft:item/stick"}}
                """);
        ResourceTree tree = load(ConverterOptions.defaults());

        ConversionException error = assertThrows(ConversionException.class,
                () -> normalizer.normalize(tree, ConversionContext.defaults()));

        assertTrue(error.locations().contains("assets/minecraft/items/stick.json"));
    }

    private ResourceTree load(ConverterOptions options) throws IOException {
        return ResourceTree.load(tempDir, options);
    }
}
