package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.packmigrator.TestPacks;
import dev.badgersnacks.packmigrator.errors.AmbiguousPredicateException;
import dev.badgersnacks.packmigrator.errors.DuplicateVariantException;
import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import dev.badgersnacks.packmigrator.util.ResourceId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemModelConverterTest {

    @TempDir
    Path tempDir;

    private final ItemModelConverter converter = new ItemModelConverter();
    private final ConverterOptions options = ConverterOptions.defaults();

    @Test
    void splitsTheStickIntoOneModelPerValue() throws IOException {
        TestPacks.stickPack(tempDir);
        ResourceTree output = ResourceTree.empty();

        ConversionOutput result = converter.convert(load(), output, ConversionContext.of(options));

        JsonNode base = output.readJson("assets/minecraft/models/item/stick.json");
        assertFalse(base.has("overrides"));
        assertEquals("minecraft:item/stick", base.path("textures").path("layer0").asText());
        JsonNode blue = output.readJson("assets/minecraft/models/item/stick_1001.json");
        assertEquals("minecraft:item/stick_blue", blue.path("textures").path("layer0").asText());
        JsonNode red = output.readJson("assets/minecraft/models/item/stick_1002.json");
        assertEquals("minecraft:item/stick_red", red.path("textures").path("layer0").asText());

        JsonNode root = output.readJson("assets/minecraft/items/stick.json").path("model");
        assertEquals("minecraft:range_dispatch", root.path("type").asText());
        assertEquals("minecraft:custom_model_data", root.path("property").asText());
        assertEquals(1001, root.path("entries").get(0).path("threshold").asInt());
        assertEquals("minecraft:item/stick_1001", root.path("entries").get(0).path("model").path("model").asText());
        assertEquals(1002, root.path("entries").get(1).path("threshold").asInt());
        assertEquals("minecraft:item/stick_1002", root.path("entries").get(1).path("model").path("model").asText());
        assertEquals(1003, root.path("entries").get(2).path("threshold").asInt());
        assertEquals("minecraft:item/stick", root.path("entries").get(2).path("model").path("model").asText());
        assertEquals(3, root.path("entries").size());
        assertEquals("minecraft:item/stick", root.path("fallback").path("model").asText());

        JsonNode standalone = output.readJson("assets/minecraft/items/stick_1001.json").path("model");
        assertEquals("minecraft:model", standalone.path("type").asText());
        assertEquals("minecraft:item/stick_1001", standalone.path("model").asText());

        assertEquals(3, result.report().variantsGenerated());
        assertTrue(result.generated().contains(new AssetLocation(AssetKind.MODEL, ResourceId.parse("item/stick_1002"))));
        assertDoesNotThrow(() -> new ReferenceValidator().validate(output, options, result.generated(), result.writtenDocuments()));
    }

    @Test
    void valuesBetweenOverridesFallBackToTheBase() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"parent": "item/generated", "overrides": [
                  {"predicate": {"custom_model_data": 20}, "model": "item/stick_red"},
                  {"predicate": {"custom_model_data": 5}, "model": "item/stick_blue"}
                ]}
                """);
        ResourceTree output = ResourceTree.empty();

        converter.convert(load(), output, ConversionContext.of(options));

        JsonNode entries = output.readJson("assets/minecraft/items/stick.json").path("model").path("entries");
        assertEquals(4, entries.size());
        assertEquals(5, entries.get(0).path("threshold").asInt());
        assertEquals("minecraft:item/stick_5", entries.get(0).path("model").path("model").asText());
        assertEquals(6, entries.get(1).path("threshold").asInt());
        assertEquals("minecraft:item/stick", entries.get(1).path("model").path("model").asText());
        assertEquals(20, entries.get(2).path("threshold").asInt());
        assertEquals("minecraft:item/stick_20", entries.get(2).path("model").path("model").asText());
        assertEquals(21, entries.get(3).path("threshold").asInt());
    }

    @Test
    void forcedSelectEncodingMatchesStringCases() throws IOException {
        TestPacks.stickPack(tempDir);
        ConverterOptions select = options.withPredicateEncoding(PredicateEncoding.SELECT);
        ResourceTree output = ResourceTree.empty();

        converter.convert(ResourceTree.load(tempDir, select), output, ConversionContext.of(select));

        JsonNode root = output.readJson("assets/minecraft/items/stick.json").path("model");
        assertEquals("minecraft:select", root.path("type").asText());
        assertTrue(root.path("cases").get(0).path("when").isTextual());
        assertEquals("1001", root.path("cases").get(0).path("when").asText());
        assertEquals("minecraft:item/stick_1001", root.path("cases").get(0).path("model").path("model").asText());
    }

    @Test
    void everyDefinitionYieldsOneVariantPerOverridePlusBase() throws IOException {
        TestPacks.stickPack(tempDir);
        TestPacks.write(tempDir, "assets/custom/models/item/gem.json", """
                {"parent": "item/generated", "textures": {"layer0": "custom:item/gem"}, "overrides": [
                  {"predicate": {"custom_model_data": 1}, "model": "custom:item/gem_green"},
                  {"predicate": {"custom_model_data": 2}, "model": "custom:item/gem_green"},
                  {"predicate": {"custom_model_data": 3}, "model": "minecraft:item/emerald"}
                ]}
                """);
        TestPacks.write(tempDir, "assets/custom/models/item/gem_green.json", """
                {"textures": {"layer0": "custom:item/gem_green"}}
                """);
        TestPacks.write(tempDir, "assets/custom/textures/item/gem.png", "png");
        TestPacks.write(tempDir, "assets/custom/textures/item/gem_green.png", "png");
        ResourceTree output = ResourceTree.empty();

        ConversionOutput result = converter.convert(load(), output, ConversionContext.of(options));

        assertEquals(3 + 4, result.report().variantsGenerated());
        JsonNode merged = output.readJson("assets/custom/models/item/gem_2.json");
        assertEquals("minecraft:item/generated", ResourceId.parse(merged.path("parent").asText()).asString());
        assertEquals("custom:item/gem_green", merged.path("textures").path("layer0").asText());
        JsonNode gameModel = output.readJson("assets/custom/models/item/gem_3.json");
        assertEquals("minecraft:item/emerald", gameModel.path("parent").asText());
        assertEquals(4, output.readJson("assets/custom/items/gem.json").path("model").path("entries").size());
        assertDoesNotThrow(() -> new ReferenceValidator().validate(output, options, result.generated(), result.writtenDocuments()));
    }

    @Test
    void overrideWithItsOwnParentReplacesTheBase() throws IOException {
        TestPacks.stickPack(tempDir);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick_blue.json", """
                {"parent": "minecraft:item/handheld", "textures": {"layer0": "minecraft:item/stick_blue"}}
                """);
        ResourceTree output = ResourceTree.empty();

        converter.convert(load(), output, ConversionContext.of(options));

        JsonNode blue = output.readJson("assets/minecraft/models/item/stick_1001.json");
        assertEquals("minecraft:item/handheld", blue.path("parent").asText());
        assertEquals(1, blue.path("textures").size());
    }

    @Test
    void duplicateValuesCollide() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"parent": "item/generated", "overrides": [
                  {"predicate": {"custom_model_data": 3}, "model": "item/stick_blue"},
                  {"predicate": {"custom_model_data": 3}, "model": "item/stick_red"}
                ]}
                """);

        DuplicateVariantException error = assertThrows(DuplicateVariantException.class,
                () -> converter.convert(load(), ResourceTree.empty(), ConversionContext.of(options)));

        assertTrue(error instanceof AmbiguousPredicateException);
        assertEquals(ResourceId.parse("item/stick_3"), error.variantId());
        assertEquals(2, error.locations().size());
    }

    @Test
    void generatedIdentifierMustNotShadowAnotherAsset() throws IOException {
        TestPacks.stickPack(tempDir);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick_1001.json", "{\"parent\": \"item/generated\"}");

        DuplicateVariantException error = assertThrows(DuplicateVariantException.class,
                () -> converter.convert(load(), ResourceTree.empty(), ConversionContext.of(options)));

        assertTrue(error.locations().contains("assets/minecraft/models/item/stick_1001.json"));
    }

    @Test
    void overrideAlreadyNamedLikeItsVariantIsAccepted() throws IOException {
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick.json", """
                {"parent": "item/generated", "overrides": [
                  {"predicate": {"custom_model_data": 1001}, "model": "item/stick_1001"}
                ]}
                """);
        TestPacks.write(tempDir, "assets/minecraft/models/item/stick_1001.json", """
                {"textures": {"layer0": "item/stick"}}
                """);
        ResourceTree output = ResourceTree.empty();

        ConversionOutput result = converter.convert(load(), output, ConversionContext.of(options));

        assertEquals(2, result.report().variantsGenerated());
        assertEquals("item/generated", output.readJson("assets/minecraft/models/item/stick_1001.json").path("parent").asText());
    }

    private ResourceTree load() throws IOException {
        return ResourceTree.load(tempDir, options);
    }
}
