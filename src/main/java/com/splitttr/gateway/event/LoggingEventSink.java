package com.splitttr.gateway.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/**
 * Writes every event as one JSON line to the {@code collab.events} logger.
 */
public final class LoggingEventSink implements CollaborationEventSink {

    private static final Logger EVENTS = Logger.getLogger("collab.events");

    private final ObjectMapper mapper;

    public LoggingEventSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void emit(CollaborationEvent event) {
        Logger.Level level = event.level().loggerLevel();
        if (!EVENTS.isEnabled(level)) {
            return;
        }
        EVENTS.log(level, toJson(event));
    }

    String toJson(CollaborationEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            return event.toString();
        }
    }
}
