package com.splitttr.gateway.room;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomRegistryTest {

    private final RoomRegistry registry = new RoomRegistry();

    @Test
    void addAndLookUp() {
        TransientRoom room = new TransientRoom("global");

        registry.addRoom("global", room);

        assertThat(registry.roomExists("global")).isTrue();
        assertThat(registry.getRoom("global")).isSameAs(room);
        assertThat(registry.findRoom("global")).containsSame(room);
    }

    @Test
    void duplicateAddIsRefused() {
        registry.addRoom("global", new TransientRoom("global"));

        assertThatThrownBy(() -> registry.addRoom("global", new TransientRoom("global")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingRoom() {
        assertThatThrownBy(() -> registry.getRoom("nope")).isInstanceOf(NoSuchElementException.class);
        assertThat(registry.findRoom("nope")).isEmpty();
    }

    @Test
    void getOrCreateReusesRegisteredRoom() {
        Room first = registry.getOrCreate("global", TransientRoom::new);
        Room second = registry.getOrCreate("global", id -> {
            throw new AssertionError("factory must not run");
        });

        assertThat(second).isSameAs(first);
    }

    @Test
    void deleteOnlyRemovesTheSameInstance() {
        TransientRoom stale = new TransientRoom("global");
        TransientRoom current = new TransientRoom("global");
        registry.addRoom("global", current);

        assertThat(registry.deleteRoom(stale)).isFalse();
        assertThat(registry.getRoom("global")).isSameAs(current);

        assertThat(registry.deleteRoom(current)).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    void countsRelayedMessages() {
        registry.messageRelayed();
        registry.messageRelayed();

        assertThat(registry.relayedMessages()).isEqualTo(2);
    }

    @Test
    void connectedUsersDirectory() {
        ConnectedUsers users = registry.connectedUsers();

        users.joined(7, "Ada");

        assertThat(users.nameOf(7)).contains("Ada");
        assertThat(users.left(7)).contains("Ada");
        assertThat(users.left(7)).isEmpty();
        assertThat(users.size()).isZero();
    }
}
