package com.splitttr.gateway.contents;

import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link FileIdManager} keeping the id index in memory. Ids live as long as the process.
 */
public final class InMemoryFileIdManager implements FileIdManager {

    private static final Logger LOG = Logger.getLogger(InMemoryFileIdManager.class);

    private final ContentsStore contents;
    private final ConcurrentHashMap<String, String> idsByPath = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> pathsById = new ConcurrentHashMap<>();

    public InMemoryFileIdManager(ContentsStore contents) {
        this.contents = Objects.requireNonNull(contents, "contents");
    }

    @Override
    public Optional<String> getId(String path) {
        return Optional.ofNullable(idsByPath.get(normalize(path)));
    }

    @Override
    public synchronized Optional<String> index(String path) {
        String key = normalize(path);
        String existing = idsByPath.get(key);
        if (existing != null) {
            return Optional.of(existing);
        }
        if (!contents.exists(key)) {
            return Optional.empty();
        }
        String id = UUID.randomUUID().toString();
        idsByPath.put(key, id);
        pathsById.put(id, key);
        LOG.debugf("Indexed %s as %s", key, id);
        return Optional.of(id);
    }

    @Override
    public Optional<String> getPath(String fileId) {
        return Optional.ofNullable(pathsById.get(fileId));
    }

    @Override
    public synchronized void move(String oldPath, String newPath) {
        String from = normalize(oldPath);
        String to = normalize(newPath);
        String id = idsByPath.remove(from);
        if (id == null) {
            return;
        }
        idsByPath.put(to, id);
        pathsById.put(id, to);
    }

    private static String normalize(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
