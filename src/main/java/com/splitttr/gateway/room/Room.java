package com.splitttr.gateway.room;

import com.splitttr.gateway.message.MessageFormatException;
import com.splitttr.gateway.message.YMessageType;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Shared in-memory state of one room and the clients connected to it.
 *
 * <p>Each client is served by its own relay task running {@link #serve(RoomClient)}, which
 * consumes the client's frames in arrival order until the client disconnects.
 */
public abstract class Room {

    private static final Logger LOG = Logger.getLogger(Room.class);

    public static final int CLOSE_PROTOCOL_ERROR = 1002;

    protected final String roomId;
    protected final Set<RoomClient> clients = new CopyOnWriteArraySet<>();
    protected final Awareness awareness = new Awareness();

    protected Room(String roomId) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
    }

    public String id() {
        return roomId;
    }

    public List<RoomClient> clients() {
        return List.copyOf(clients);
    }

    public boolean hasClients() {
        return !clients.isEmpty();
    }

    public Awareness awareness() {
        return awareness;
    }

    /**
     * Registers {@code client}.
     *
     * @return {@code false} if the room no longer accepts clients and must be resolved again
     */
    public abstract boolean attach(RoomClient client);

    public abstract void detach(RoomClient client);

    /**
     * Relays the frames of {@code client} until it disconnects, then detaches it. A malformed
     * frame closes that client only.
     */
    public void serve(RoomClient client) {
        try {
            onServeStart(client);
            byte[] message;
            while ((message = client.receive()) != null) {
                try {
                    handleMessage(client, message);
                } catch (MessageFormatException e) {
                    LOG.warnf("Closing client %s of room %s: %s", client.id(), roomId, e.getMessage());
                    client.close(CLOSE_PROTOCOL_ERROR, "Malformed message");
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            detach(client);
        }
    }

    protected void onServeStart(RoomClient client) {
    }

    protected void handleMessage(RoomClient from, byte[] message) {
        if (message.length == 0) {
            throw new MessageFormatException("Empty frame");
        }
        Optional<YMessageType> type = YMessageType.of(message[0] & 0xFF);
        if (type.isPresent() && type.get() == YMessageType.SYNC) {
            handleSync(from, message);
        } else if (type.isPresent() && type.get() == YMessageType.AWARENESS) {
            // forwarded to the sender too, clients use it as a keep-alive
            broadcast(message, null);
        } else {
            broadcast(message, from);
        }
    }

    protected abstract void handleSync(RoomClient from, byte[] frame);

    protected void broadcast(byte[] message, RoomClient exclude) {
        for (RoomClient client : clients) {
            if (client != exclude) {
                client.send(message);
            }
        }
    }
}
