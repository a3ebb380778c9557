package dev.badgersnacks.packmigrator.persistence;

import dev.badgersnacks.packmigrator.errors.PathSecurityException;
import dev.badgersnacks.packmigrator.services.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Copies the input pack, a folder or a ZIP archive, into a private staging directory so a run
 * never reads from or writes to the user's files.
 */
public class PackStager {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackStager.class);
    private static final String PACK_META = "pack.mcmeta";
    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:.*");
    static final String PHASE = "stage";

    /** Stages {@code input}, picking the archive or directory variant by its type. */
    public void stage(Path input, Path staging, ConversionContext context) throws IOException {
        if (Files.isDirectory(input)) {
            stageDirectory(input, staging, context);
        } else if (Files.isRegularFile(input) && input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip")) {
            stageArchive(input, staging, context);
        } else {
            throw new IOException("Input " + input + " is neither a folder nor a .zip archive");
        }
    }

    public void stageDirectory(Path source, Path staging, ConversionContext context) throws IOException {
        ConverterOptions options = context.options();
        Files.createDirectories(staging);
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(source) && options.isExcludedDirectory(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        int completed = 0;
        for (Path file : files) {
            Path target = staging.resolve(source.relativize(file).toString());
            Files.createDirectories(target.getParent());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            context.checkpoint(PHASE, ++completed, files.size());
        }
        LOGGER.info("Staged {} files from {}", files.size(), source);
    }

    /**
     * Extracts {@code archive} into {@code staging}. Every entry name is checked before anything
     * is written; a single unsafe name rejects the whole archive. When the pack sits in one
     * top-level folder, that folder is stripped.
     *
     * @throws PathSecurityException for absolute, drive-rooted or parent-escaping entry names
     */
    public void stageArchive(Path archive, Path staging, ConversionContext context) throws IOException {
        ConverterOptions options = context.options();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            List<ZipEntry> files = new ArrayList<>();
            for (ZipEntry entry : Collections.list(zip.entries())) {
                checkEntryName(entry.getName(), archive);
                if (entry.isDirectory() || isExcluded(entry.getName(), options)) {
                    continue;
                }
                files.add(entry);
            }
            String root = packRoot(files);
            if (!root.isEmpty()) {
                LOGGER.debug("Stripping top-level folder {} of {}", root, archive);
            }
            Files.createDirectories(staging);
            Path normalizedStaging = staging.toAbsolutePath().normalize();
            int completed = 0;
            int extracted = 0;
            for (ZipEntry entry : files) {
                completed++;
                if (!entry.getName().startsWith(root)) {
                    LOGGER.debug("Ignoring {} outside pack folder {}", entry.getName(), root);
                    continue;
                }
                Path target = normalizedStaging.resolve(entry.getName().substring(root.length())).normalize();
                if (!target.startsWith(normalizedStaging)) {
                    throw new PathSecurityException(entry.getName(), archive.toString());
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                extracted++;
                context.checkpoint(PHASE, completed, files.size());
            }
            LOGGER.info("Extracted {} files from {}", extracted, archive);
        }
    }

    static void checkEntryName(String name, Path archive) throws PathSecurityException {
        if (name.isEmpty() || name.startsWith("/") || name.startsWith("\\") || DRIVE_LETTER.matcher(name).matches()) {
            throw new PathSecurityException(name, archive.toString());
        }
        for (String segment : name.split("[/\\\\]")) {
            if (segment.equals("..")) {
                throw new PathSecurityException(name, archive.toString());
            }
        }
    }

    private static boolean isExcluded(String name, ConverterOptions options) {
        for (String segment : name.split("/")) {
            if (options.isExcludedDirectory(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Prefix to strip: empty when {@code pack.mcmeta} is at the archive root, otherwise the single
     * folder holding it.
     */
    private static String packRoot(List<ZipEntry> files) {
        String root = null;
        for (ZipEntry entry : files) {
            String name = entry.getName();
            if (name.equals(PACK_META)) {
                return "";
            }
            if (name.endsWith("/" + PACK_META) && name.indexOf('/') == name.length() - PACK_META.length() - 1) {
                root = name.substring(0, name.length() - PACK_META.length());
            }
        }
        return root == null ? "" : root;
    }
}
