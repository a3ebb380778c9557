package dev.badgersnacks.packmigrator.errors;

import java.util.List;

/**
 * Archive entry that would escape the staging directory.
 */
public class PathSecurityException extends ConversionException {

    public PathSecurityException(String entryName, String archive) {
        super("Refusing unsafe archive entry '" + entryName + "' in " + archive, List.of(archive, entryName));
    }
}
