package dev.badgersnacks.packmigrator.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.services.TargetProfile;
import dev.badgersnacks.packmigrator.util.ResourceId;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one conversion run. Every field falls back to a default when absent.
 *
 * @param targetVersion       game version the converted pack is meant for
 * @param predicateEncoding   forces an encoding instead of the target version's default
 * @param defaultNamespace    namespace of identifiers written without one
 * @param builtInNamespaces   namespaces whose assets the game ships, so they may be absent from the pack
 * @param excludedDirectories directory names never read from the input
 * @param relocations         relocations applied after the target version's own layout rules
 */
public record ConverterOptions(
        @JsonProperty("targetVersion") String targetVersion,
        @JsonProperty("predicateEncoding") PredicateEncoding predicateEncoding,
        @JsonProperty("defaultNamespace") String defaultNamespace,
        @JsonProperty("builtInNamespaces") List<String> builtInNamespaces,
        @JsonProperty("excludedDirectories") List<String> excludedDirectories,
        @JsonProperty("relocations") List<RelocationRule> relocations) {

    public static final String DEFAULT_TARGET_VERSION = "1.21.4";
    private static final List<String> DEFAULT_EXCLUDED = List.of(".git", ".svn", ".hg");

    public ConverterOptions {
        if (targetVersion == null || targetVersion.isBlank()) {
            targetVersion = DEFAULT_TARGET_VERSION;
        }
        if (defaultNamespace == null || defaultNamespace.isBlank()) {
            defaultNamespace = ResourceId.DEFAULT_NAMESPACE;
        }
        builtInNamespaces = builtInNamespaces == null ? List.of(ResourceId.DEFAULT_NAMESPACE) : List.copyOf(builtInNamespaces);
        excludedDirectories = excludedDirectories == null ? DEFAULT_EXCLUDED : List.copyOf(excludedDirectories);
        relocations = relocations == null ? List.of() : List.copyOf(relocations);
        TargetProfile.forVersion(targetVersion);
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(null, null, null, null, null, null);
    }

    public ConverterOptions withTargetVersion(String version) {
        return new ConverterOptions(version, predicateEncoding, defaultNamespace, builtInNamespaces,
                excludedDirectories, relocations);
    }

    public ConverterOptions withPredicateEncoding(PredicateEncoding encoding) {
        return new ConverterOptions(targetVersion, encoding, defaultNamespace, builtInNamespaces,
                excludedDirectories, relocations);
    }

    public ConverterOptions withBuiltInNamespaces(List<String> namespaces) {
        return new ConverterOptions(targetVersion, predicateEncoding, defaultNamespace, namespaces,
                excludedDirectories, relocations);
    }

    public ConverterOptions withRelocations(List<RelocationRule> rules) {
        return new ConverterOptions(targetVersion, predicateEncoding, defaultNamespace, builtInNamespaces,
                excludedDirectories, rules);
    }

    public TargetProfile profile() {
        return TargetProfile.forVersion(targetVersion);
    }

    public PredicateEncoding encoding() {
        return predicateEncoding != null ? predicateEncoding : profile().defaultEncoding();
    }

    public boolean isBuiltIn(String namespace) {
        return builtInNamespaces.contains(namespace);
    }

    public boolean isExcludedDirectory(String name) {
        return excludedDirectories.contains(name);
    }

    /** Layout rules of the effective encoding followed by the configured relocations. */
    public List<RelocationRule> layout() {
        List<RelocationRule> rules = new ArrayList<>(TargetProfile.layoutFor(encoding()));
        rules.addAll(relocations);
        return List.copyOf(rules);
    }
}
