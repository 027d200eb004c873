package com.splitttr.gateway.event;

@FunctionalInterface
public interface CollaborationEventSink {

    void emit(CollaborationEvent event);
}
