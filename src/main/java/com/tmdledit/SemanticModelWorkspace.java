package com.tmdledit;

import com.tmdledit.errors.InvalidEncodingException;
import com.tmdledit.errors.TmdlException;
import com.tmdledit.errors.TmdlMutationException;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.writer.IdentifierQuoting;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File access for one semantic model inside a Power BI project folder.
 * Table files live under {@code definition/tables}; relationships in
 * {@code definition/relationships.tmdl}.
 *
 * <p>Edits of the same file are serialized by a per-file lock and written through a temporary
 * file that is moved over the original, so readers never see a half-written file.
 */
public class SemanticModelWorkspace {

    private static final String TMDL_SUFFIX = ".tmdl";

    private final Path modelRoot;
    private final TmdlEditor editor;
    private final ChangePreview preview = new ChangePreview();
    private final Map<Path, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface DocumentEdit {
        TmdlDocument apply(TmdlDocument document) throws TmdlMutationException;
    }

    /**
     * Result of one file edit. {@code written} is false for dry runs and for edits that left
     * the text unchanged.
     */
    public record FileEdit(Path file, String before, String after, TmdlDocument document, String diff,
                           boolean written) {}

    private SemanticModelWorkspace(Path modelRoot, TmdlEditor editor) {
        this.modelRoot = modelRoot;
        this.editor = editor;
        log("Opened semantic model at " + modelRoot);
    }

    // -------------------------------------------------------------------------
    // Model Discovery
    // -------------------------------------------------------------------------

    /**
     * Opens a model from a {@code .pbip} file, a project folder, or the model folder itself.
     *
     * @throws FileNotFoundException if no semantic model folder can be found
     */
    public static SemanticModelWorkspace open(Path path, TmdlEditor editor) throws IOException {
        Path start = path.toAbsolutePath().normalize();
        if (!Files.exists(start)) {
            throw new FileNotFoundException("Project path not found: " + path);
        }
        Path modelRoot = findModelRoot(start);
        if (modelRoot == null) {
            throw new FileNotFoundException("No semantic model folder found at: " + path);
        }
        return new SemanticModelWorkspace(modelRoot, editor);
    }

    private static Path findModelRoot(Path start) throws IOException {
        if (Files.isRegularFile(start)) {
            String fileName = start.getFileName().toString();
            if (!fileName.toLowerCase(Locale.ROOT).endsWith(".pbip")) {
                return null;
            }
            String projectName = fileName.substring(0, fileName.length() - ".pbip".length());
            return findModelIn(start.getParent(), projectName);
        }
        if (Files.isDirectory(start.resolve("definition"))) {
            return start;
        }
        String projectName = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(start, "*.pbip")) {
            for (Path pbip : stream) {
                String fileName = pbip.getFileName().toString();
                projectName = fileName.substring(0, fileName.length() - ".pbip".length());
                break;
            }
        }
        return findModelIn(start, projectName);
    }

    private static Path findModelIn(Path projectDir, String projectName) throws IOException {
        List<Path> candidates = new ArrayList<>();
        if (projectName != null) {
            candidates.add(projectDir.resolve(projectName + ".SemanticModel"));
            candidates.add(projectDir.resolve(projectName + ".Dataset"));
        }
        candidates.add(projectDir.resolve("SemanticModel"));
        candidates.add(projectDir.resolve("Dataset"));
        for (Path candidate : candidates) {
            if (Files.isDirectory(candidate.resolve("definition"))) {
                return candidate;
            }
        }
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectDir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry) && (name.endsWith(".SemanticModel") || name.endsWith(".Dataset"))) {
                    found.add(entry);
                }
            }
        }
        found.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return found.isEmpty() ? null : found.get(0);
    }

    public Path getModelRoot() {
        return modelRoot;
    }

    public Path getDefinitionDir() {
        return modelRoot.resolve("definition");
    }

    public Path getTablesDir() {
        return getDefinitionDir().resolve("tables");
    }

    public Path getRelationshipsFile() {
        return getDefinitionDir().resolve("relationships.tmdl");
    }

    public Path getModelFile() {
        return getDefinitionDir().resolve("model.tmdl");
    }

    /**
     * Resolves a model-relative path, rejecting paths that leave the model folder.
     *
     * @throws SecurityException if the path escapes the model root
     */
    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return modelRoot;
        }
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        Path resolved = modelRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(modelRoot)) {
            throw new SecurityException("Path escapes model root: " + relativePath);
        }
        return resolved;
    }

    public String toRelativePath(Path absolutePath) {
        return modelRoot.relativize(absolutePath.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    // -------------------------------------------------------------------------
    // Table Files
    // -------------------------------------------------------------------------

    /**
     * Table files in model order: tables referenced by {@code ref table} lines in
     * {@code model.tmdl} first, then the remaining files by name.
     */
    public List<Path> listTableFiles() throws IOException {
        Path tablesDir = getTablesDir();
        if (!Files.isDirectory(tablesDir)) {
            return new ArrayList<>();
        }
        Map<String, Path> byName = new LinkedHashMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tablesDir, "*" + TMDL_SUFFIX)) {
            List<Path> files = new ArrayList<>();
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
            files.sort(Comparator.comparing(p -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER));
            for (Path file : files) {
                byName.put(baseName(file), file);
            }
        }
        List<Path> ordered = new ArrayList<>();
        for (String ref : readTableRefs()) {
            Path file = byName.remove(ref);
            if (file != null) {
                ordered.add(file);
            }
        }
        ordered.addAll(byName.values());
        return ordered;
    }

    private List<String> readTableRefs() throws IOException {
        List<String> refs = new ArrayList<>();
        Path modelFile = getModelFile();
        if (!Files.isRegularFile(modelFile)) {
            return refs;
        }
        for (String line : Files.readAllLines(modelFile, StandardCharsets.UTF_8)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("ref table ")) {
                refs.add(IdentifierQuoting.unquote(trimmed.substring("ref table ".length())));
            }
        }
        return refs;
    }

    /**
     * Finds the file declaring a table: by file name first, then by the table declared inside.
     *
     * @return the file, or null when no table file declares that table
     */
    public Path findTableFile(String tableName) throws IOException {
        List<Path> files = listTableFiles();
        for (Path file : files) {
            if (baseName(file).equals(tableName)) {
                return file;
            }
        }
        for (Path file : files) {
            if (baseName(file).equalsIgnoreCase(tableName)) {
                return file;
            }
        }
        for (Path file : files) {
            try {
                if (readDocument(file).getTable(tableName) != null) {
                    return file;
                }
            } catch (TmdlException e) {
                log("Skipping unparsable table file " + file.getFileName() + ": " + e.getMessage());
            }
        }
        return null;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(TMDL_SUFFIX) ? name.substring(0, name.length() - TMDL_SUFFIX.length()) : name;
    }

    // -------------------------------------------------------------------------
    // Read / Edit
    // -------------------------------------------------------------------------

    /**
     * Reads a file as strict UTF-8.
     *
     * @throws InvalidEncodingException if the bytes are not valid UTF-8
     */
    public String readText(Path file) throws IOException, InvalidEncodingException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("File not found: " + toRelativePath(file));
        }
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidEncodingException(toRelativePath(file) + " is not valid UTF-8 ("
                + e.getClass().getSimpleName() + ")");
        }
    }

    public TmdlDocument readDocument(Path file) throws IOException, TmdlException {
        return editor.parse(readText(file));
    }

    /**
     * Parses the file, applies the edit and, unless {@code dryRun}, writes the result back.
     * The whole read-modify-write runs under the file's lock.
     */
    public FileEdit edit(Path file, DocumentEdit edit, boolean dryRun) throws IOException, TmdlException {
        Path key = file.toAbsolutePath().normalize();
        ReentrantLock lock = fileLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            String before = readText(key);
            TmdlDocument edited = edit.apply(editor.parse(before));
            String after = editor.serialize(edited);
            String diff = preview.unifiedDiff(toRelativePath(key), before, after);
            boolean write = !dryRun && !after.equals(before);
            if (write) {
                writeAtomically(key, after);
                log("Wrote " + toRelativePath(key));
            } else {
                log((dryRun ? "Dry run, not writing " : "No change to ") + toRelativePath(key));
            }
            return new FileEdit(key, before, after, edited, diff, write);
        } finally {
            lock.unlock();
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", ".tmp");
        try {
            Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
            copyPermissions(target, temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Temporary files are created owner-only; the replaced file keeps the permissions it had.
     */
    private void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) {
            return;
        }
        PosixFileAttributeView source = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        PosixFileAttributeView target = Files.getFileAttributeView(to, PosixFileAttributeView.class);
        if (source == null || target == null) {
            return;
        }
        target.setPermissions(source.readAttributes().permissions());
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SemanticModelWorkspace] " + message);
        }
    }
}
