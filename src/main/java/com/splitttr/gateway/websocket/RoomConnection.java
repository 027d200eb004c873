package com.splitttr.gateway.websocket;

import com.splitttr.gateway.contents.StorageException;
import com.splitttr.gateway.event.CollaborationEvent;
import com.splitttr.gateway.event.CollaborationEventSink;
import com.splitttr.gateway.event.LogLevel;
import com.splitttr.gateway.message.AwarenessUpdate;
import com.splitttr.gateway.message.MessageFormatException;
import com.splitttr.gateway.message.YMessageType;
import com.splitttr.gateway.room.AwarenessChanges;
import com.splitttr.gateway.room.ConnectedUsers;
import com.splitttr.gateway.room.DocumentKey;
import com.splitttr.gateway.room.DocumentRoom;
import com.splitttr.gateway.room.Room;
import com.splitttr.gateway.room.RoomClient;
import com.splitttr.gateway.room.RoomManager;
import com.splitttr.gateway.session.SessionIssuer;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges one client connection to its room.
 *
 * <p>Inbound frames are queued as they arrive and consumed in order by a relay task running
 * {@link Room#serve(RoomClient)}; closing the connection enqueues an end-of-stream marker that
 * stops the relay task, which then detaches the client from the room. Awareness updates that
 * arrive before the connection has joined its room are held and applied once it has.
 */
public final class RoomConnection implements RoomClient {

    private static final Logger LOG = Logger.getLogger(RoomConnection.class);

    public static final int CLOSE_PROTOCOL_ERROR = 1002;
    public static final int CLOSE_UNSUPPORTED_DATA = 1003;
    public static final int CLOSE_INTERNAL_ERROR = 1011;

    private static final byte[] END_OF_STREAM = new byte[0];

    private final String connectionId;
    private final String roomId;
    private final ConnectionChannel channel;
    private final RoomManager roomManager;
    private final SessionIssuer sessionIssuer;
    private final Executor relayExecutor;
    private final CollaborationEventSink events;
    private final BlockingQueue<byte[]> messages = new LinkedBlockingQueue<>();
    private final Object awarenessLock = new Object();
    private final List<AwarenessUpdate> pendingAwareness = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Room room;

    public RoomConnection(String connectionId,
                          String roomId,
                          ConnectionChannel channel,
                          RoomManager roomManager,
                          SessionIssuer sessionIssuer,
                          Executor relayExecutor,
                          CollaborationEventSink events) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.roomManager = Objects.requireNonNull(roomManager, "roomManager");
        this.sessionIssuer = Objects.requireNonNull(sessionIssuer, "sessionIssuer");
        this.relayExecutor = Objects.requireNonNull(relayExecutor, "relayExecutor");
        this.events = Objects.requireNonNull(events, "events");
    }

    @Override
    public String id() {
        return connectionId;
    }

    public String roomId() {
        return roomId;
    }

    public Room room() {
        return room;
    }

    /**
     * Joins the room and starts relaying. Document rooms require the current session token
     * and are initialized before any traffic is relayed.
     *
     * @return {@code false} if the connection was refused and closed
     */
    public boolean open(String sessionId) {
        boolean documentRoom = DocumentKey.isDocumentRoom(roomId);
        if (documentRoom && !sessionIssuer.isCurrent(sessionId)) {
            LOG.warnf("Refusing connection %s to room %s: document session %s expired", connectionId, roomId, sessionId);
            close(CLOSE_UNSUPPORTED_DATA, "Document session " + sessionId + " expired");
            return false;
        }

        Room joined = null;
        try {
            joined = join();
            joinedRoom(joined);
            if (joined instanceof DocumentRoom document) {
                document.initialize();
                emitConnected(document);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to open room %s for connection %s", roomId, connectionId);
            if (joined != null) {
                joined.detach(this);
            }
            synchronized (awarenessLock) {
                room = null;
                pendingAwareness.clear();
            }
            close(CLOSE_INTERNAL_ERROR, "Failed to open room " + roomId);
            return false;
        }

        Room served = joined;
        relayExecutor.execute(() -> served.serve(this));
        return true;
    }

    public void onMessage(byte[] message) {
        if (closed.get()) {
            return;
        }
        if (message.length == 0) {
            LOG.warnf("Empty frame on connection %s", connectionId);
            close(CLOSE_PROTOCOL_ERROR, "Empty frame");
            return;
        }
        if ((message[0] & 0xFF) == YMessageType.AWARENESS.code()) {
            try {
                applyAwareness(AwarenessUpdate.decode(message));
            } catch (MessageFormatException e) {
                LOG.warnf("Malformed awareness message on connection %s: %s", connectionId, e.getMessage());
                close(CLOSE_PROTOCOL_ERROR, "Malformed awareness message");
                return;
            }
        }
        messages.offer(message);
        roomManager.registry().messageRelayed();
    }

    /**
     * Ends the relay of this connection. Only the first call has an effect.
     */
    public void onClose() {
        if (closed.compareAndSet(false, true)) {
            messages.offer(END_OF_STREAM);
        }
    }

    @Override
    public byte[] receive() throws InterruptedException {
        byte[] message = messages.take();
        return message == END_OF_STREAM ? null : message;
    }

    @Override
    public synchronized void send(byte[] message) {
        if (closed.get()) {
            return;
        }
        try {
            channel.send(message);
        } catch (RuntimeException e) {
            LOG.debugf(e, "Failed to write message to connection %s", connectionId);
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            channel.close(code, reason);
        } catch (RuntimeException e) {
            LOG.debugf(e, "Failed to close connection %s", connectionId);
        }
    }

    private Room join() {
        while (true) {
            Room resolved = roomManager.resolve(roomId);
            if (resolved.attach(this)) {
                return resolved;
            }
            LOG.debugf("Room %s was destroyed while connecting %s, resolving it again", roomId, connectionId);
        }
    }

    private void joinedRoom(Room joined) {
        synchronized (awarenessLock) {
            room = joined;
            try {
                for (AwarenessUpdate update : pendingAwareness) {
                    trackUsers(joined.awareness().apply(update));
                }
            } catch (MessageFormatException e) {
                LOG.warnf("Malformed awareness message on connection %s: %s", connectionId, e.getMessage());
                close(CLOSE_PROTOCOL_ERROR, "Malformed awareness message");
            } finally {
                pendingAwareness.clear();
            }
        }
    }

    private void applyAwareness(AwarenessUpdate update) {
        synchronized (awarenessLock) {
            Room current = room;
            if (current == null) {
                pendingAwareness.add(update);
            } else {
                trackUsers(current.awareness().apply(update));
            }
        }
    }

    private void trackUsers(AwarenessChanges changes) {
        ConnectedUsers users = roomManager.registry().connectedUsers();
        for (Long clientId : changes.added()) {
            changes.userName(clientId).ifPresent(name -> {
                users.joined(clientId, name);
                LOG.debugf("Y user joined: %s", name);
            });
        }
        for (Long clientId : changes.removed()) {
            users.left(clientId).ifPresent(name -> LOG.debugf("Y user left: %s", name));
        }
    }

    private void emitConnected(DocumentRoom document) {
        String path;
        try {
            path = document.loader().path();
        } catch (StorageException e) {
            path = null;
        }
        events.emit(new CollaborationEvent(LogLevel.INFO, roomId, path, "initialize", "New client connected."));
    }
}
