package com.splitttr.gateway.room;

import org.jboss.logging.Logger;

/**
 * Room without durable backing, e.g. the global awareness channel. Sync frames are relayed to
 * the other clients without interpretation.
 */
public final class TransientRoom extends Room {

    private static final Logger LOG = Logger.getLogger(TransientRoom.class);

    public TransientRoom(String roomId) {
        super(roomId);
    }

    @Override
    public boolean attach(RoomClient client) {
        clients.add(client);
        LOG.debugf("Client %s joined transient room %s", client.id(), roomId);
        return true;
    }

    @Override
    public void detach(RoomClient client) {
        clients.remove(client);
    }

    @Override
    protected void handleSync(RoomClient from, byte[] frame) {
        broadcast(frame, from);
    }
}
