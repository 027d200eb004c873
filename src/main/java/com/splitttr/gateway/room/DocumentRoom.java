package com.splitttr.gateway.room;

import com.splitttr.gateway.contents.ContentModel;
import com.splitttr.gateway.contents.StorageException;
import com.splitttr.gateway.event.CollaborationEvent;
import com.splitttr.gateway.event.CollaborationEventSink;
import com.splitttr.gateway.event.LogLevel;
import com.splitttr.gateway.loader.FileLoader;
import com.splitttr.gateway.message.MessageFormatException;
import com.splitttr.gateway.message.SyncMessage;
import com.splitttr.gateway.scheduling.Cancellable;
import com.splitttr.gateway.scheduling.TaskScheduler;
import com.splitttr.gateway.ydoc.SharedDocument;
import com.splitttr.gateway.ystore.UpdateStore;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Room backed by a stored document.
 *
 * <p>The in-memory {@link SharedDocument} is authoritative while the room lives; the stored
 * resource is a checkpoint written through the room's {@link FileLoader}. Every accepted update
 * is appended to the room's {@link UpdateStore}.
 *
 * <p>Lifecycle: {@code UNINITIALIZED -> INITIALIZING -> LIVE -> CLEANUP_SCHEDULED -> DESTROYED},
 * with {@code CLEANUP_SCHEDULED -> LIVE} when a client attaches before the grace period ends.
 * Phase changes and the client set are guarded by one monitor, so a destroy only happens while
 * no client is attached and an attach racing with a pending destroy wins.
 *
 * <p>Document changes, whether from a client or from storage, are applied one at a time together
 * with their broadcast, log append and save, so saves are submitted in the order the document
 * changed.
 */
public final class DocumentRoom extends Room {

    private static final Logger LOG = Logger.getLogger(DocumentRoom.class);

    /**
     * Called, under the room's lifecycle monitor, once the room is destroyed.
     */
    @FunctionalInterface
    public interface DestroyListener {
        void destroyed(DocumentRoom room);
    }

    private final DocumentKey key;
    private final FileLoader loader;
    private final SharedDocument document;
    private final UpdateStore updates;
    private final TaskScheduler scheduler;
    private final Duration cleanupDelay;
    private final CollaborationEventSink events;
    private final DestroyListener destroyListener;

    private final Object lifecycle = new Object();
    private final Object initialization = new Object();
    private final Object edits = new Object();
    private RoomPhase phase = RoomPhase.UNINITIALIZED;
    private Cancellable cleaner;

    /**
     * @param cleanupDelay grace period before an empty room is destroyed, {@code null} to keep
     *                     empty rooms forever
     */
    public DocumentRoom(String roomId,
                        DocumentKey key,
                        FileLoader loader,
                        SharedDocument document,
                        UpdateStore updates,
                        TaskScheduler scheduler,
                        Duration cleanupDelay,
                        CollaborationEventSink events,
                        DestroyListener destroyListener) {
        super(roomId);
        this.key = Objects.requireNonNull(key, "key");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.document = Objects.requireNonNull(document, "document");
        this.updates = Objects.requireNonNull(updates, "updates");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.cleanupDelay = cleanupDelay;
        this.events = Objects.requireNonNull(events, "events");
        this.destroyListener = Objects.requireNonNull(destroyListener, "destroyListener");
    }

    public DocumentKey key() {
        return key;
    }

    public FileLoader loader() {
        return loader;
    }

    public SharedDocument document() {
        return document;
    }

    public RoomPhase phase() {
        synchronized (lifecycle) {
            return phase;
        }
    }

    public boolean isReady() {
        RoomPhase current = phase();
        return current == RoomPhase.LIVE || current == RoomPhase.CLEANUP_SCHEDULED;
    }

    @Override
    public boolean attach(RoomClient client) {
        synchronized (lifecycle) {
            if (phase == RoomPhase.DESTROYED) {
                return false;
            }
            if (cleaner != null) {
                cleaner.cancel();
                cleaner = null;
                LOG.debugf("Cancelled cleanup of room %s", roomId);
            }
            if (phase == RoomPhase.CLEANUP_SCHEDULED) {
                phase = RoomPhase.LIVE;
            }
            clients.add(client);
            return true;
        }
    }

    @Override
    public void detach(RoomClient client) {
        synchronized (lifecycle) {
            if (!clients.remove(client)) {
                return;
            }
            if (!clients.isEmpty()) {
                return;
            }
            if (phase == RoomPhase.LIVE) {
                scheduleCleanupLocked();
            } else if (phase == RoomPhase.UNINITIALIZED) {
                // initialization failed for every client; the next connection starts over
                destroyLocked();
            }
        }
    }

    /**
     * Loads the document on first use: stored content, then the update log, then subscribes to
     * out-of-band changes. Later calls return immediately.
     *
     * @throws StorageException if the stored content cannot be read
     */
    public void initialize() {
        synchronized (initialization) {
            synchronized (lifecycle) {
                if (phase != RoomPhase.UNINITIALIZED) {
                    return;
                }
                phase = RoomPhase.INITIALIZING;
            }
            try {
                load();
            } catch (RuntimeException e) {
                synchronized (lifecycle) {
                    phase = RoomPhase.UNINITIALIZED;
                }
                throw e;
            }
            synchronized (lifecycle) {
                phase = RoomPhase.LIVE;
                if (clients.isEmpty()) {
                    scheduleCleanupLocked();
                }
            }
            emit(LogLevel.INFO, "initialize", "Room initialized");
        }
    }

    /**
     * Destroys the room now, whatever its clients. Used on shutdown.
     */
    public void close() {
        synchronized (lifecycle) {
            if (phase == RoomPhase.DESTROYED) {
                return;
            }
            if (cleaner != null) {
                cleaner.cancel();
                cleaner = null;
            }
            destroyLocked();
        }
    }

    @Override
    protected void onServeStart(RoomClient client) {
        client.send(SyncMessage.step1(document.encodeStateVector()).encode());
    }

    @Override
    protected void handleSync(RoomClient from, byte[] frame) {
        SyncMessage message = SyncMessage.decode(frame);
        synchronized (edits) {
            switch (message.type()) {
                case STEP1 -> from.send(SyncMessage.step2(document.encodeStateAsUpdate(message.payload())).encode());
                case STEP2, UPDATE -> {
                    if (document.applyUpdate(message.payload())) {
                        onRemoteUpdate(from, message.payload());
                    }
                }
            }
        }
    }

    void destroyIfIdle() {
        synchronized (lifecycle) {
            if (phase != RoomPhase.CLEANUP_SCHEDULED || !clients.isEmpty()) {
                return;
            }
            cleaner = null;
            destroyLocked();
        }
    }

    private void load() {
        ContentModel model = loader.load(key.format(), key.type());
        String content = model.content() != null ? model.content() : "";
        boolean readFromSource = true;

        List<byte[]> logged = updates.replay();
        if (!logged.isEmpty()) {
            try {
                for (byte[] update : logged) {
                    document.applyUpdate(update);
                }
                readFromSource = !content.equals(document.getSource());
                if (readFromSource) {
                    emit(LogLevel.INFO, "initialize", "The file is out-of-sync with the ystore.");
                }
            } catch (MessageFormatException e) {
                LOG.warnf(e, "Update log of room %s is unreadable, loading from storage", roomId);
            }
        }

        if (readFromSource) {
            byte[] update = document.setSource(content);
            appendToLog(update);
            emit(LogLevel.INFO, "load", "Content loaded from disk.");
        }
        loader.observe(roomId, this::onContentChanged);
    }

    private void onRemoteUpdate(RoomClient from, byte[] update) {
        broadcast(SyncMessage.update(update).encode(), from);
        appendToLog(update);
        loader.save(ContentModel.of(key.format(), key.type(), document.getSource()));
    }

    private void onContentChanged(ContentModel model) {
        synchronized (edits) {
            if (model.content() == null || model.content().equals(document.getSource())) {
                return;
            }
            byte[] update = document.setSource(model.content());
            broadcast(SyncMessage.update(update).encode(), null);
            appendToLog(update);
        }
        emit(LogLevel.INFO, "overwrite", "Out-of-band changes. Overwriting the content in room " + roomId);
    }

    private void appendToLog(byte[] update) {
        try {
            updates.append(update);
        } catch (StorageException e) {
            LOG.warnf(e, "Failed to append to the update log of room %s", roomId);
        }
    }

    private void scheduleCleanupLocked() {
        if (cleanupDelay == null) {
            LOG.debugf("Room %s is empty, automatic cleanup is disabled", roomId);
            return;
        }
        LOG.infof("Cleaning room: %s", roomId);
        phase = RoomPhase.CLEANUP_SCHEDULED;
        cleaner = scheduler.schedule(this::destroyIfIdle, cleanupDelay);
    }

    private void destroyLocked() {
        phase = RoomPhase.DESTROYED;
        LOG.infof("Deleting Y document from memory: %s", roomId);
        loader.unobserve(roomId);
        try {
            destroyListener.destroyed(this);
        } finally {
            updates.close();
        }
    }

    private void emit(LogLevel level, String action, String msg) {
        events.emit(new CollaborationEvent(level, roomId, pathOrNull(), action, msg));
    }

    private String pathOrNull() {
        try {
            return loader.path();
        } catch (StorageException e) {
            return null;
        }
    }
}
