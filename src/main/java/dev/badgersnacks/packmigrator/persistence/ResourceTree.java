package dev.badgersnacks.packmigrator.persistence;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * In-memory view of a resource pack directory keyed by forward-slash relative path.
 *
 * <p>Entries are either untouched files, read from their source only when needed, or JSON
 * documents that have been parsed and possibly rewritten. Changes stay in memory until
 * {@link #flush(Path)} writes them.
 */
public final class ResourceTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceTree.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true);

    private final SortedMap<String, Entry> entries = new TreeMap<>();
    private final Set<String> dirty = new TreeSet<>();
    private final Set<String> removed = new TreeSet<>();

    public static ResourceTree empty() {
        return new ResourceTree();
    }

    /**
     * Reads the file listing of {@code root}, skipping hidden files and the excluded directories.
     * File contents are loaded lazily.
     */
    public static ResourceTree load(Path root, ConverterOptions options) throws IOException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(options, "options");
        if (!Files.isDirectory(root)) {
            throw new IOException("Pack root " + root + " is not a directory");
        }
        ResourceTree tree = new ResourceTree();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (options.isExcludedDirectory(name) || name.startsWith(".")) {
                    LOGGER.debug("Skipping directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !file.getFileName().toString().startsWith(".")) {
                    tree.entries.put(relativize(root, file), Entry.ofSource(file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return tree;
    }

    public static boolean isJsonPath(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Sorted snapshot of every path in the tree. */
    public List<String> paths() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    /**
     * Parses the entry as JSON, caching the result. Malformed content surfaces as the parser's
     * {@link IOException}. The returned node is shared: rewrite a copy and store it with
     * {@link #putDocument(String, JsonNode)}.
     */
    public JsonNode readJson(String path) throws IOException {
        Entry entry = require(path);
        if (entry.document == null) {
            entry.document = MAPPER.readTree(entry.bytes());
            if (entry.document == null || entry.document.isMissingNode()) {
                throw new IOException("Empty JSON document " + path);
            }
        }
        return entry.document;
    }

    /** Returns the parsed document if the entry has already been read as JSON. */
    public Optional<JsonNode> document(String path) {
        Entry entry = entries.get(path);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.document);
    }

    public void putDocument(String path, JsonNode document) {
        Objects.requireNonNull(document, "document");
        entries.put(checkPath(path), Entry.ofDocument(document));
        markDirty(path);
    }

    /**
     * Copies an entry of another tree unchanged. Parsed documents are deep-copied so the two trees
     * never share mutable nodes.
     */
    public void copyFrom(ResourceTree source, String path) {
        Entry entry = source.require(path);
        Entry copy = new Entry(entry.source, entry.raw, entry.document == null ? null : entry.document.deepCopy());
        entries.put(checkPath(path), copy);
        markDirty(path);
    }

    /** Moves an entry. The content is detached from its old file first, so deleting it is safe. */
    public void move(String from, String to) throws IOException {
        if (from.equals(to)) {
            return;
        }
        Entry entry = require(from);
        if (entry.source != null && entry.raw == null) {
            entry.raw = Files.readAllBytes(entry.source);
        }
        entries.remove(from);
        markRemoved(from);
        entries.put(checkPath(to), entry);
        markDirty(to);
    }

    public void remove(String path) {
        if (entries.remove(path) != null) {
            markRemoved(path);
        }
    }

    /** Serialized content of the entry, as {@link #flush(Path)} would write it. */
    public byte[] bytes(String path) throws IOException {
        return require(path).bytes();
    }

    /** Paths changed since the tree was loaded or created. */
    public Set<String> changedPaths() {
        return Set.copyOf(dirty);
    }

    public Set<String> removedPaths() {
        return Set.copyOf(removed);
    }

    /**
     * Writes every changed entry below {@code root}, each one through a temporary sibling that is
     * renamed into place, and only then deletes removed entries and the directories they emptied.
     */
    public void flush(Path root) throws IOException {
        Files.createDirectories(root);
        Path normalizedRoot = root.toAbsolutePath().normalize();
        for (String path : dirty) {
            Path target = resolveInside(normalizedRoot, path);
            Files.createDirectories(target.getParent());
            writeAtomically(target, entries.get(path).bytes());
        }
        for (String path : removed) {
            Path target = resolveInside(normalizedRoot, path);
            Files.deleteIfExists(target);
            pruneEmptyParents(normalizedRoot, target.getParent());
        }
        LOGGER.debug("Flushed {} changed and {} removed files to {}", dirty.size(), removed.size(), root);
        dirty.clear();
        removed.clear();
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void pruneEmptyParents(Path root, Path directory) throws IOException {
        Path current = directory;
        while (current != null && !current.equals(root) && current.startsWith(root) && Files.isDirectory(current)) {
            try (Stream<Path> children = Files.list(current)) {
                if (children.findAny().isPresent()) {
                    return;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    private static Path resolveInside(Path root, String path) throws IOException {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IOException("Path " + path + " escapes " + root);
        }
        return resolved;
    }

    private void markDirty(String path) {
        removed.remove(path);
        dirty.add(path);
    }

    private void markRemoved(String path) {
        dirty.remove(path);
        removed.add(path);
    }

    private Entry require(String path) {
        Entry entry = entries.get(path);
        if (entry == null) {
            throw new IllegalArgumentException("No entry " + path + " in resource tree");
        }
        return entry;
    }

    private static String checkPath(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isBlank() || path.startsWith("/") || path.contains("\\")) {
            throw new IllegalArgumentException("Invalid tree path: " + path);
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("Invalid tree path: " + path);
            }
        }
        return path;
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static final class Entry {
        private final Path source;
        private byte[] raw;
        private JsonNode document;

        private Entry(Path source, byte[] raw, JsonNode document) {
            this.source = source;
            this.raw = raw;
            this.document = document;
        }

        static Entry ofSource(Path source) {
            return new Entry(source, null, null);
        }

        static Entry ofDocument(JsonNode document) {
            return new Entry(null, null, document);
        }

        byte[] bytes() throws IOException {
            if (source == null && raw == null) {
                return MAPPER.writeValueAsBytes(document);
            }
            if (raw != null) {
                return raw;
            }
            return Files.readAllBytes(source);
        }
    }
}
