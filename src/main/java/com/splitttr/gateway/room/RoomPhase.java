package com.splitttr.gateway.room;

public enum RoomPhase {
    UNINITIALIZED,
    INITIALIZING,
    LIVE,
    CLEANUP_SCHEDULED,
    DESTROYED
}
