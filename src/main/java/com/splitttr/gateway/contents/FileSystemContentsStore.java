package com.splitttr.gateway.contents;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * {@link ContentsStore} over a local directory tree.
 *
 * <p>Paths are relative to the root and may not escape it. Content is UTF-8 text for the
 * {@code text} and {@code json} formats and Base64 for {@code base64}. Writes go to a temporary
 * sibling first and are moved into place.
 */
public final class FileSystemContentsStore implements ContentsStore {

    private static final Logger LOG = Logger.getLogger(FileSystemContentsStore.class);

    private final Path root;

    public FileSystemContentsStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public ContentModel get(String path, String format, String type, boolean includeContent) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new ContentNotFoundException(path);
        }
        String resolvedType = type != null ? type : guessType(file);
        String resolvedFormat = format != null ? format : defaultFormat(resolvedType);
        try {
            Instant lastModified = Files.getLastModifiedTime(file).toInstant();
            String content = includeContent ? read(file, resolvedFormat) : null;
            return new ContentModel(path, file.getFileName().toString(), resolvedFormat, resolvedType, content, lastModified);
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(path);
        } catch (IOException e) {
            throw new StorageException("Failed to read '" + path + "'", e);
        }
    }

    @Override
    public ContentModel save(String path, ContentModel model) {
        Path file = resolve(path);
        String format = model.format() != null ? model.format() : defaultFormat(model.type());
        byte[] bytes = encode(path, format, model.content());
        try {
            Path parent = file.getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "." + file.getFileName(), ".tmp");
            try {
                Files.write(tmp, bytes);
                move(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
            Instant lastModified = Files.getLastModifiedTime(file).toInstant();
            LOG.debugf("Saved %d bytes to %s", bytes.length, path);
            return new ContentModel(path, file.getFileName().toString(), format, model.type(), null, lastModified);
        } catch (IOException e) {
            throw new StorageException("Failed to write '" + path + "'", e);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            return Files.isRegularFile(resolve(path));
        } catch (StorageException e) {
            return false;
        }
    }

    public Path resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new StorageException("Path '" + path + "' is outside of the contents root");
        }
        return resolved;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static byte[] encode(String path, String format, String content) {
        if (!"base64".equals(format)) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            throw new InvalidContentException("Content of '" + path + "' is not valid base64", e);
        }
    }

    private static String read(Path file, String format) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        if ("base64".equals(format)) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String guessType(Path file) {
        return file.getFileName().toString().endsWith(".ipynb") ? "notebook" : "file";
    }

    private static String defaultFormat(String type) {
        return "notebook".equals(type) ? "json" : "text";
    }
}
