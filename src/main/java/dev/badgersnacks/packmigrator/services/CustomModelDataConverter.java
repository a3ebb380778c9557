package dev.badgersnacks.packmigrator.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.packmigrator.errors.AmbiguousPredicateException;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.model.ItemDefinition;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.model.PredicateOverride;
import dev.badgersnacks.packmigrator.scanner.AssetClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rewrites legacy custom model data overrides into the encoding of the target version.
 *
 * <p>The referenced models are neither moved nor rewritten here. For item definition encodings the
 * legacy file keeps its base model fields and gains a top-level {@code model} tree; splitting the
 * two apart is left to {@link FolderStructureNormalizer}.
 */
public class CustomModelDataConverter extends LegacyDefinitionConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CustomModelDataConverter.class);

    public CustomModelDataConverter() {
        this(new AssetClassifier(), new PackMetaRewriter());
    }

    public CustomModelDataConverter(AssetClassifier classifier, PackMetaRewriter packMetaRewriter) {
        super(classifier, packMetaRewriter);
    }

    @Override
    protected String phase() {
        return "custom model data";
    }

    @Override
    protected void convertDefinition(ItemDefinition definition, DefinitionScope scope, Set<AssetLocation> generated)
            throws AmbiguousPredicateException {
        rejectDuplicates(definition);
        List<PredicateOverride> overrides = resolvableOverrides(definition, scope);
        PredicateEncoding encoding = scope.options().encoding();
        ObjectNode rewritten = encoding == PredicateEncoding.PREDICATE
                ? rewritePredicates(definition, overrides)
                : rewriteAsItemModel(definition, overrides, encoding);
        scope.output().putDocument(definition.sourcePath(), rewritten);
        LOGGER.debug("Rewrote {} with {} overrides as {}", definition.sourcePath(), overrides.size(), encoding);
    }

    /**
     * Fails when two overrides share a value: only one of them could ever be selected.
     */
    static void rejectDuplicates(ItemDefinition definition) throws AmbiguousPredicateException {
        Map<Integer, PredicateOverride> seen = new HashMap<>();
        for (PredicateOverride override : definition.overrides()) {
            PredicateOverride previous = seen.putIfAbsent(override.customModelDataValue(), override);
            if (previous != null) {
                throw new AmbiguousPredicateException(override.customModelDataValue(),
                        definition.describe(previous), definition.describe(override));
            }
        }
    }

    private ObjectNode rewritePredicates(ItemDefinition definition, List<PredicateOverride> overrides) {
        Map<Integer, PredicateOverride> byIndex = overrides.stream()
                .collect(Collectors.toMap(PredicateOverride::index, override -> override));
        Set<Integer> cmdIndexes = definition.overrides().stream()
                .map(PredicateOverride::index)
                .collect(Collectors.toSet());
        ArrayNode translated = JsonNodeFactory.instance.arrayNode();
        ArrayNode raw = definition.rawOverrides();
        for (int i = 0; i < raw.size(); i++) {
            JsonNode entry = raw.get(i);
            PredicateOverride override = byIndex.get(i);
            if (override != null) {
                ObjectNode copy = entry.deepCopy();
                ObjectNode predicate = copy.putObject("predicate");
                predicate.put(ItemDefinitionReader.CUSTOM_MODEL_DATA, override.customModelDataValue());
                copy.put("model", override.modelReference().asString());
                translated.add(copy);
            } else if (!cmdIndexes.contains(i)) {
                translated.add(entry.deepCopy());
            }
        }
        ObjectNode document = definition.baseDeclaration().deepCopy();
        document.set("overrides", translated);
        return document;
    }

    private ObjectNode rewriteAsItemModel(ItemDefinition definition,
                                          List<PredicateOverride> overrides,
                                          PredicateEncoding encoding) {
        if (definition.otherOverrideCount() > 0) {
            LOGGER.warn("Dropping {} overrides of {} that are not plain custom model data",
                    definition.otherOverrideCount(), definition.sourcePath());
        }
        ObjectNode model;
        if (encoding == PredicateEncoding.SELECT) {
            model = ItemModelNodes.select(definition.modelId());
            overrides.forEach(override ->
                    ItemModelNodes.addCase(model, override.customModelDataValue(), override.modelReference()));
        } else {
            model = ItemModelNodes.rangeDispatch(definition.modelId());
            overrides.forEach(override ->
                    ItemModelNodes.addThreshold(model, override.customModelDataValue(), override.modelReference()));
        }
        ObjectNode document = definition.baseDeclaration().deepCopy();
        document.set("model", model);
        return document;
    }
}
