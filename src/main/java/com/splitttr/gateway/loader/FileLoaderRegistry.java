package com.splitttr.gateway.loader;

import com.splitttr.gateway.contents.ContentsStore;
import com.splitttr.gateway.contents.FileIdManager;
import com.splitttr.gateway.contents.StorageException;
import com.splitttr.gateway.scheduling.TaskScheduler;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a file id to its single shared {@link FileLoader}, counting subscriptions.
 *
 * <p>Creation, subscription and teardown of a loader happen inside one
 * {@link ConcurrentHashMap#compute} call per file id, so two loaders never exist for the same
 * id and a release racing with an acquire cannot tear down a loader the acquirer got.
 */
public class FileLoaderRegistry {

    private static final Logger LOG = Logger.getLogger(FileLoaderRegistry.class);

    private final ConcurrentHashMap<String, FileLoader> loaders = new ConcurrentHashMap<>();

    private final FileIdManager fileIdManager;
    private final ContentsStore contents;
    private final TaskScheduler scheduler;
    private final Duration saveDelay;
    private final Duration pollInterval;

    public FileLoaderRegistry(FileIdManager fileIdManager,
                              ContentsStore contents,
                              TaskScheduler scheduler,
                              Duration saveDelay,
                              Duration pollInterval) {
        this.fileIdManager = Objects.requireNonNull(fileIdManager, "fileIdManager");
        this.contents = Objects.requireNonNull(contents, "contents");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.saveDelay = Objects.requireNonNull(saveDelay, "saveDelay");
        this.pollInterval = pollInterval;
    }

    /**
     * Returns the loader of {@code fileId}, creating it if needed, and counts one more
     * subscription on it. Every call must be paired with {@link #release(String)}.
     */
    public FileLoader acquire(String fileId) {
        return loaders.compute(fileId, (id, existing) -> {
            FileLoader loader = existing != null ? existing : create(id);
            loader.retain();
            return loader;
        });
    }

    /**
     * Drops one subscription. The last one flushes the pending save, stops the watcher and
     * forgets the loader.
     */
    public void release(String fileId) {
        loaders.computeIfPresent(fileId, (id, loader) -> {
            if (loader.release() > 0) {
                return loader;
            }
            teardown(loader);
            return null;
        });
    }

    public Optional<FileLoader> find(String fileId) {
        return Optional.ofNullable(loaders.get(fileId));
    }

    public boolean contains(String fileId) {
        return loaders.containsKey(fileId);
    }

    public int size() {
        return loaders.size();
    }

    /**
     * Tears down every loader regardless of subscriptions.
     */
    public void clear() {
        for (String fileId : List.copyOf(loaders.keySet())) {
            loaders.computeIfPresent(fileId, (id, loader) -> {
                teardown(loader);
                return null;
            });
        }
    }

    private FileLoader create(String fileId) {
        FileLoader loader = new FileLoader(fileId, fileIdManager, contents, scheduler, saveDelay, pollInterval);
        try {
            loader.refresh();
        } catch (StorageException e) {
            LOG.warnf(e, "Could not read the initial state of file %s", fileId);
        }
        LOG.debugf("Created loader for file %s", fileId);
        return loader;
    }

    private static void teardown(FileLoader loader) {
        try {
            loader.flush();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to flush file %s before deleting its loader", loader.fileId());
        } finally {
            loader.clean();
        }
        LOG.infof("Deleted loader for file %s", loader.fileId());
    }
}
