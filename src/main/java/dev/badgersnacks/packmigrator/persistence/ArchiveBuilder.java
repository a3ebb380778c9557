package dev.badgersnacks.packmigrator.persistence;

import dev.badgersnacks.packmigrator.services.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs a resource tree into a ZIP archive that depends only on the tree's content: entries are
 * sorted, carry one fixed timestamp, and directories get no entries of their own.
 */
public class ArchiveBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveBuilder.class);
    static final String PHASE = "archive";
    static final LocalDateTime ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    /**
     * Writes {@code tree} to {@code destination}. The archive is assembled in a temporary file
     * beside the destination and renamed into place once complete, so a failed or cancelled run
     * leaves no partial archive behind.
     */
    public void build(ResourceTree tree, Path destination, ConversionContext context) throws IOException {
        Objects.requireNonNull(tree, "tree");
        Path target = destination.toAbsolutePath().normalize();
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        boolean finished = false;
        try {
            List<String> paths = tree.paths();
            context.progress().message("Writing " + paths.size() + " entries to " + target.getFileName());
            try (OutputStream out = Files.newOutputStream(temp);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                int completed = 0;
                for (String path : paths) {
                    ZipEntry entry = new ZipEntry(path);
                    entry.setTimeLocal(ENTRY_TIME);
                    zip.putNextEntry(entry);
                    zip.write(tree.bytes(path));
                    zip.closeEntry();
                    context.checkpoint(PHASE, ++completed, paths.size());
                }
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            finished = true;
            LOGGER.info("Wrote archive {} with {} entries", target, paths.size());
        } finally {
            if (!finished) {
                Files.deleteIfExists(temp);
                LOGGER.debug("Discarded unfinished archive {}", temp);
            }
        }
    }
}
