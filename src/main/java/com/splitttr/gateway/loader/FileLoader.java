package com.splitttr.gateway.loader;

import com.splitttr.gateway.contents.ContentModel;
import com.splitttr.gateway.contents.ContentNotFoundException;
import com.splitttr.gateway.contents.ContentsStore;
import com.splitttr.gateway.contents.FileIdManager;
import com.splitttr.gateway.contents.InvalidContentException;
import com.splitttr.gateway.contents.StorageException;
import com.splitttr.gateway.scheduling.Cancellable;
import com.splitttr.gateway.scheduling.Debouncer;
import com.splitttr.gateway.scheduling.TaskScheduler;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the durable copy of one resource, identified by its file id.
 *
 * <p>The loader tracks the last modification time it knows about. {@link #notifyChanges()}
 * compares it with the store and informs observers when the resource moved forward, either on
 * demand or from a periodic watcher. Saves are debounced: only the newest content submitted
 * within the delay window is written. Every storage access goes through one lock, so writes to
 * the resource never overlap and observers never run after {@link #clean()} returned.
 */
public class FileLoader {

    private static final Logger LOG = Logger.getLogger(FileLoader.class);

    private final String fileId;
    private final FileIdManager fileIdManager;
    private final ContentsStore contents;
    private final Debouncer<ContentModel> saver;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ContentChangeListener> listeners = new ConcurrentHashMap<>();
    private final AtomicInteger subscriptions = new AtomicInteger();

    private volatile Instant lastModified;
    private volatile String format;
    private volatile String type;
    private volatile boolean closed;
    private Cancellable watcher;

    /**
     * @param pollInterval period of the background watcher, {@code null} to rely on explicit
     *                     {@link #notifyChanges()} calls
     */
    public FileLoader(String fileId,
                      FileIdManager fileIdManager,
                      ContentsStore contents,
                      TaskScheduler scheduler,
                      Duration saveDelay,
                      Duration pollInterval) {
        this.fileId = Objects.requireNonNull(fileId, "fileId");
        this.fileIdManager = Objects.requireNonNull(fileIdManager, "fileIdManager");
        this.contents = Objects.requireNonNull(contents, "contents");
        this.saver = new Debouncer<>(scheduler, saveDelay, this::write);
        if (pollInterval != null) {
            this.watcher = scheduler.scheduleWithFixedDelay(this::watch, pollInterval, pollInterval);
        }
    }

    public String fileId() {
        return fileId;
    }

    /**
     * Current path of the resource. Resolved on every call since the resource may be renamed.
     */
    public String path() {
        return fileIdManager.getPath(fileId)
                .orElseThrow(() -> new StorageException("No path is indexed for file id " + fileId));
    }

    public Instant lastModified() {
        return lastModified;
    }

    public int subscriptionCount() {
        return subscriptions.get();
    }

    public boolean isClosed() {
        return closed;
    }

    public void observe(String key, ContentChangeListener listener) {
        listeners.put(key, listener);
    }

    public void unobserve(String key) {
        listeners.remove(key);
    }

    /**
     * Adopts the stored modification time as the baseline without notifying anybody.
     */
    public void refresh() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            lastModified = contents.get(path(), format, type, false).lastModified();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads the full content and adopts its modification time.
     */
    public ContentModel load(String format, String type) {
        lock.lock();
        try {
            this.format = format;
            this.type = type;
            ContentModel model = contents.get(path(), format, type, true);
            lastModified = model.lastModified();
            return model;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Informs observers if the stored resource is strictly newer than the last known version.
     * An unknown baseline is adopted silently.
     *
     * @throws StorageException if the store cannot be read
     */
    public void notifyChanges() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            String path = path();
            Instant stored = contents.get(path, format, type, false).lastModified();
            Instant known = lastModified;
            if (known == null) {
                lastModified = stored;
                return;
            }
            if (stored == null || !stored.isAfter(known)) {
                return;
            }
            ContentModel model = contents.get(path, format, type, true);
            LOG.infof("Out-of-band changes detected on %s", path);
            fire(model);
            lastModified = model.lastModified() != null ? model.lastModified() : stored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schedules {@code model} to be written once the save delay elapses without a newer save.
     */
    public void save(ContentModel model) {
        if (closed) {
            LOG.debugf("Ignoring save on closed loader %s", fileId);
            return;
        }
        saver.submit(model);
    }

    public boolean hasPendingSave() {
        return saver.isPending();
    }

    /**
     * Writes the pending save, if any, on the calling thread.
     */
    public void flush() {
        saver.flush();
    }

    /**
     * Stops the watcher and drops any pending save. Idempotent.
     */
    public void clean() {
        lock.lock();
        try {
            closed = true;
            if (watcher != null) {
                watcher.cancel();
                watcher = null;
            }
            saver.cancel();
            listeners.clear();
        } finally {
            lock.unlock();
        }
    }

    int retain() {
        return subscriptions.incrementAndGet();
    }

    int release() {
        return subscriptions.updateAndGet(count -> Math.max(0, count - 1));
    }

    private void watch() {
        try {
            notifyChanges();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Error watching file %s, retrying on next poll", fileId);
        }
    }

    private void write(ContentModel model) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            String path = path();
            if (changedOnStorage(path)) {
                ContentModel external = contents.get(path, model.format(), model.type(), true);
                LOG.warnf("Out-of-band changes while saving %s, keeping the stored version", path);
                fire(external);
                lastModified = external.lastModified();
                return;
            }
            ContentModel saved = contents.save(path, model);
            lastModified = saved.lastModified();
            LOG.debugf("Saved %s", path);
        } catch (InvalidContentException e) {
            LOG.errorf(e, "Dropping content of file %s that cannot be written", fileId);
        } catch (StorageException e) {
            LOG.warnf(e, "Error saving file %s, retrying on next save cycle", fileId);
            if (!closed) {
                saver.submitIfIdle(model);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error saving file %s", fileId);
        } finally {
            lock.unlock();
        }
    }

    private boolean changedOnStorage(String path) {
        Instant known = lastModified;
        if (known == null) {
            return false;
        }
        try {
            Instant stored = contents.get(path, format, type, false).lastModified();
            return stored != null && stored.isAfter(known);
        } catch (ContentNotFoundException e) {
            return false;
        }
    }

    private void fire(ContentModel model) {
        for (Map.Entry<String, ContentChangeListener> entry : List.copyOf(listeners.entrySet())) {
            try {
                entry.getValue().contentChanged(model);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Observer %s failed to handle changes of %s", entry.getKey(), fileId);
            }
        }
    }
}
