package com.splitttr.gateway.room;

import com.splitttr.gateway.contents.ContentNotFoundException;
import com.splitttr.gateway.contents.FileIdManager;
import com.splitttr.gateway.event.CollaborationEvent;
import com.splitttr.gateway.event.CollaborationEventSink;
import com.splitttr.gateway.event.LogLevel;
import com.splitttr.gateway.loader.FileLoader;
import com.splitttr.gateway.loader.FileLoaderRegistry;
import com.splitttr.gateway.scheduling.TaskScheduler;
import com.splitttr.gateway.ydoc.DocumentEngine;
import com.splitttr.gateway.ystore.UpdateStore;
import com.splitttr.gateway.ystore.UpdateStoreFactory;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolves room ids to rooms, creating them on first access and tearing them down when a
 * document room's grace period expires.
 */
public class RoomManager {

    private static final Logger LOG = Logger.getLogger(RoomManager.class);

    static final String CONFLICT_MESSAGE = "There is another collaborative session accessing the same file.\n"
        + "The synchronization between rooms is not supported and you might lose some of your changes.";

    private final RoomRegistry registry;
    private final FileLoaderRegistry loaders;
    private final FileIdManager fileIdManager;
    private final UpdateStoreFactory updateStores;
    private final DocumentEngine engine;
    private final TaskScheduler scheduler;
    private final Duration cleanupDelay;
    private final CollaborationEventSink events;

    public RoomManager(RoomRegistry registry,
                       FileLoaderRegistry loaders,
                       FileIdManager fileIdManager,
                       UpdateStoreFactory updateStores,
                       DocumentEngine engine,
                       TaskScheduler scheduler,
                       Duration cleanupDelay,
                       CollaborationEventSink events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loaders = Objects.requireNonNull(loaders, "loaders");
        this.fileIdManager = Objects.requireNonNull(fileIdManager, "fileIdManager");
        this.updateStores = Objects.requireNonNull(updateStores, "updateStores");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.cleanupDelay = cleanupDelay;
        this.events = Objects.requireNonNull(events, "events");
    }

    public RoomRegistry registry() {
        return registry;
    }

    /**
     * Returns the live room of {@code roomId}, creating and registering it if needed.
     *
     * @throws ContentNotFoundException if a document room names an unknown file id
     */
    public Room resolve(String roomId) {
        return registry.getOrCreate(roomId, this::createRoom);
    }

    /**
     * Destroys every room and loader. Pending saves are flushed.
     */
    public void shutdown() {
        for (Room room : registry.rooms()) {
            if (room instanceof DocumentRoom documentRoom) {
                documentRoom.close();
            } else {
                registry.deleteRoom(room);
            }
        }
        loaders.clear();
    }

    private Room createRoom(String roomId) {
        if (!DocumentKey.isDocumentRoom(roomId)) {
            LOG.debugf("Creating transient room %s", roomId);
            return new TransientRoom(roomId);
        }

        DocumentKey key = DocumentKey.parse(roomId);
        String path = fileIdManager.getPath(key.fileId())
                .orElseThrow(() -> new ContentNotFoundException(key.fileId()));

        if (servedByAnotherRoom(roomId, key.fileId())) {
            LOG.warnf("File %s is already served by another room than %s", path, roomId);
            emit(LogLevel.WARNING, roomId, path, null, CONFLICT_MESSAGE);
        }

        FileLoader loader = loaders.acquire(key.fileId());
        UpdateStore updates;
        try {
            updates = updateStores.open(path, key.type());
        } catch (RuntimeException e) {
            loaders.release(key.fileId());
            throw e;
        }

        DocumentRoom room = new DocumentRoom(
                roomId,
                key,
                loader,
                engine.create(key.type()),
                updates,
                scheduler,
                cleanupDelay,
                events,
                this::destroyed);
        LOG.infof("Created room %s for %s", roomId, path);
        emit(LogLevel.INFO, roomId, path, "create", "Room created.");
        return room;
    }

    private boolean servedByAnotherRoom(String roomId, String fileId) {
        for (Room room : registry.rooms()) {
            if (room instanceof DocumentRoom other
                    && !other.id().equals(roomId)
                    && other.key().fileId().equals(fileId)) {
                return true;
            }
        }
        return false;
    }

    private void destroyed(DocumentRoom room) {
        String fileId = room.key().fileId();
        String path = fileIdManager.getPath(fileId).orElse(null);

        registry.deleteRoom(room);
        LOG.infof("Room %s deleted", room.id());
        emit(LogLevel.INFO, room.id(), path, "clean", "Room deleted.");

        loaders.release(fileId);
        if (!loaders.contains(fileId)) {
            emit(LogLevel.INFO, room.id(), path, "clean", "Loader deleted.");
        }
    }

    private void emit(LogLevel level, String roomId, String path, String action, String msg) {
        events.emit(new CollaborationEvent(level, roomId, path, action, msg));
    }
}
