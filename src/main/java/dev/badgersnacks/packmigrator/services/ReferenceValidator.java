package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.errors.UnresolvedReferenceException;
import dev.badgersnacks.packmigrator.model.AssetLocation;
import dev.badgersnacks.packmigrator.persistence.ConverterOptions;
import dev.badgersnacks.packmigrator.persistence.ResourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that the references a run wrote resolve before the tree may be archived. Dangling
 * references in files the run copied through untouched are reported but never fatal.
 */
public class ReferenceValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceValidator.class);

    /**
     * @param required          locations that must exist inside the tree even in a built-in namespace,
     *                          typically the ones the converter generated or moved
     * @param writtenDocuments  pack paths of the documents the run generated, rewrote or relocated
     * @throws UnresolvedReferenceException for the first unresolved reference, in index order
     */
    public void validate(ResourceTree tree,
                         ConverterOptions options,
                         Set<AssetLocation> required,
                         Set<String> writtenDocuments) throws UnresolvedReferenceException {
        ReferenceResolver resolver = new ReferenceResolver(tree, options);
        ReferenceIndex index = resolver.index();
        List<Reference> unresolved = new ArrayList<>();
        for (AssetLocation target : index.targets()) {
            if (resolver.find(target).isPresent()) {
                continue;
            }
            boolean mustExist = required.contains(target);
            if (!mustExist && resolver.isProvidedByGame(target)) {
                continue;
            }
            List<Reference> answerable = new ArrayList<>();
            for (Reference reference : index.referencesTo(target)) {
                if (mustExist || writtenDocuments.contains(reference.documentPath())) {
                    answerable.add(reference);
                }
            }
            if (answerable.isEmpty()) {
                LOGGER.warn("Missing {} is referenced only from unconverted files {}",
                        target, index.referencingDocuments(target));
                continue;
            }
            answerable.forEach(reference ->
                    LOGGER.warn("Unresolved {} referenced from {}", target, reference.describe()));
            unresolved.addAll(answerable);
        }
        if (!unresolved.isEmpty()) {
            Reference first = unresolved.get(0);
            throw new UnresolvedReferenceException(first.target().id().asString(), first.describe());
        }
    }
}
