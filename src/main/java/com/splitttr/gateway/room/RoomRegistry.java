package com.splitttr.gateway.room;

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Process-wide table of live rooms, at most one per room id.
 */
public class RoomRegistry {

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConnectedUsers connectedUsers = new ConnectedUsers();
    private final AtomicLong relayedMessages = new AtomicLong();

    public boolean roomExists(String roomId) {
        return rooms.containsKey(roomId);
    }

    /**
     * @throws NoSuchElementException if no room is registered under {@code roomId}
     */
    public Room getRoom(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new NoSuchElementException("No room " + roomId);
        }
        return room;
    }

    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * @throws IllegalStateException if a room is already registered under {@code roomId}
     */
    public void addRoom(String roomId, Room room) {
        if (rooms.putIfAbsent(roomId, room) != null) {
            throw new IllegalStateException("Room " + roomId + " already exists");
        }
    }

    /**
     * Returns the room registered under {@code roomId} or registers the one built by
     * {@code factory}. The factory runs at most once per absent id, even under concurrent calls.
     */
    public Room getOrCreate(String roomId, Function<String, ? extends Room> factory) {
        return rooms.computeIfAbsent(roomId, factory);
    }

    /**
     * Unregisters {@code room} if it is still the one registered under its id.
     *
     * @return {@code true} if it was removed
     */
    public boolean deleteRoom(Room room) {
        return rooms.remove(room.id(), room);
    }

    public Collection<Room> rooms() {
        return List.copyOf(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    public ConnectedUsers connectedUsers() {
        return connectedUsers;
    }

    public long messageRelayed() {
        return relayedMessages.incrementAndGet();
    }

    public long relayedMessages() {
        return relayedMessages.get();
    }
}
