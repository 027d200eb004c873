package com.splitttr.gateway.room;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.gateway.message.AwarenessUpdate;
import com.splitttr.gateway.message.MessageFormatException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ephemeral presence state of a room, keyed by participant client id.
 *
 * <p>An entry replaces the current one only with a higher clock; a removal also wins on an equal
 * clock.
 */
public final class Awareness {

    private static final ObjectMapper mapper = new ObjectMapper();

    private record ClientState(long clock, JsonNode state) {}

    private final Map<Long, ClientState> states = new HashMap<>();

    public synchronized AwarenessChanges apply(AwarenessUpdate update) {
        List<Long> added = new ArrayList<>();
        List<Long> updated = new ArrayList<>();
        List<Long> removed = new ArrayList<>();
        Map<Long, JsonNode> changedStates = new HashMap<>();

        for (AwarenessUpdate.Entry entry : update.entries()) {
            long clientId = entry.clientId();
            ClientState previous = states.get(clientId);
            long currentClock = previous == null ? 0 : previous.clock();
            boolean removal = entry.isRemoval();
            boolean newer = currentClock < entry.clock()
                || (currentClock == entry.clock() && removal && previous != null);
            if (!newer) {
                continue;
            }
            if (removal) {
                if (states.remove(clientId) != null) {
                    removed.add(clientId);
                }
                continue;
            }
            JsonNode state = parse(entry.state());
            states.put(clientId, new ClientState(entry.clock(), state));
            changedStates.put(clientId, state);
            if (previous == null) {
                added.add(clientId);
            } else {
                updated.add(clientId);
            }
        }
        return new AwarenessChanges(List.copyOf(added), List.copyOf(updated), List.copyOf(removed), Map.copyOf(changedStates));
    }

    public synchronized Map<Long, JsonNode> states() {
        Map<Long, JsonNode> snapshot = new HashMap<>();
        states.forEach((id, s) -> snapshot.put(id, s.state()));
        return snapshot;
    }

    public synchronized int size() {
        return states.size();
    }

    private static JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Awareness state is not valid JSON", e);
        }
    }
}
