package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reverse reference graph of a tree: for every addressed asset, the references pointing at it.
 * Built once per phase so relocations never rescan the tree.
 */
public final class ReferenceIndex {

    private final SortedMap<AssetLocation, List<Reference>> byTarget = new TreeMap<>();

    void add(Reference reference) {
        byTarget.computeIfAbsent(reference.target(), key -> new ArrayList<>()).add(reference);
    }

    public List<Reference> referencesTo(AssetLocation target) {
        return Collections.unmodifiableList(byTarget.getOrDefault(target, List.of()));
    }

    /** Pack paths of the documents referencing {@code target}. */
    public Set<String> referencingDocuments(AssetLocation target) {
        Set<String> documents = new TreeSet<>();
        for (Reference reference : referencesTo(target)) {
            documents.add(reference.documentPath());
        }
        return documents;
    }

    public Set<AssetLocation> targets() {
        return Collections.unmodifiableSet(byTarget.keySet());
    }

    /** Every reference, ordered by target and then by discovery order. */
    public List<Reference> all() {
        List<Reference> references = new ArrayList<>();
        byTarget.values().forEach(references::addAll);
        return references;
    }

    public int size() {
        return byTarget.values().stream().mapToInt(List::size).sum();
    }
}
