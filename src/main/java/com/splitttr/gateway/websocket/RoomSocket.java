package com.splitttr.gateway.websocket;

import com.splitttr.gateway.event.CollaborationEventSink;
import com.splitttr.gateway.room.RoomManager;
import com.splitttr.gateway.security.AuthService;
import com.splitttr.gateway.session.SessionIssuer;
import io.quarkus.security.Authenticated;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * WebSocket endpoint of the collaboration rooms. The last path segment is the room id.
 * Requires an authenticated caller; the upgrade is refused otherwise.
 */
@Authenticated
@WebSocket(path = "/api/collaboration/room/{roomId}")
public class RoomSocket {

    private static final Logger LOG = Logger.getLogger(RoomSocket.class);

    @Inject
    RoomManager roomManager;

    @Inject
    SessionIssuer sessionIssuer;

    @Inject
    CollaborationEventSink events;

    @Inject
    AuthService authService;

    @Inject
    @Named("collab-relay")
    ExecutorService relayExecutor;

    // Store connection state externally since the socket instance may not persist
    private static final Map<String, RoomConnection> connections = new ConcurrentHashMap<>();

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        String roomId = connection.pathParam("roomId");
        String sessionId = QueryParams.parse(connection.handshakeRequest().query()).getOrDefault("sessionId", "");
        LOG.infof("WebSocket opened: %s (user: %s, room: %s)", connection.id(), authService.getCurrentUserId(), roomId);

        RoomConnection roomConnection = new RoomConnection(
                connection.id(),
                roomId,
                new WebSocketChannel(connection),
                roomManager,
                sessionIssuer,
                relayExecutor,
                events);
        connections.put(connection.id(), roomConnection);
        roomConnection.open(sessionId);
    }

    @OnBinaryMessage
    public void onMessage(byte[] message, WebSocketConnection connection) {
        RoomConnection roomConnection = connections.get(connection.id());
        if (roomConnection != null) {
            roomConnection.onMessage(message);
        }
    }

    @OnTextMessage
    public void onTextMessage(String message, WebSocketConnection connection) {
        LOG.warnf("Text frame on connection %s, only binary frames are supported", connection.id());
        connection.closeAndAwait(new CloseReason(RoomConnection.CLOSE_UNSUPPORTED_DATA, "Binary frames only"));
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.infof("WebSocket closed: %s", connection.id());
        leave(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf(t, "WebSocket error on %s", connection.id());
        leave(connection);
    }

    private void leave(WebSocketConnection connection) {
        RoomConnection roomConnection = connections.remove(connection.id());
        if (roomConnection != null) {
            roomConnection.onClose();
        }
    }

    private record WebSocketChannel(WebSocketConnection connection) implements ConnectionChannel {

        @Override
        public void send(byte[] message) {
            connection.sendBinaryAndAwait(message);
        }

        @Override
        public void close(int code, String reason) {
            if (connection.isOpen()) {
                connection.closeAndAwait(new CloseReason(code, reason));
            }
        }
    }
}
