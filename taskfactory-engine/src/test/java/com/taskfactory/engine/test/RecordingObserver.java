package com.taskfactory.engine.test;

import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.WorkspaceEvent;
import com.taskfactory.engine.broadcast.EventObserver;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Observer that keeps every event it receives. Can be told to fail or to
 * report itself closed.
 */
public class RecordingObserver implements EventObserver {

    private final String id;
    private final List<WorkspaceEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;

    public RecordingObserver(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void deliver(WorkspaceEvent event) throws IOException {
        if (failing) {
            throw new IOException("connection reset");
        }
        events.add(event);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    public void failDeliveries() {
        failing = true;
    }

    public List<WorkspaceEvent> events() {
        return List.copyOf(events);
    }

    public List<WorkspaceEvent> eventsOfType(EventType type) {
        return events.stream().filter(e -> e.type() == type).collect(Collectors.toList());
    }

    public List<EventType> types() {
        return events.stream().map(WorkspaceEvent::type).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
