package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Control events of one staff in encounter order. Never re-sorted.
 */
public final class EventSequence implements ExtensionEntry {
    public final List<PositionedEvent> events;

    public EventSequence(List<PositionedEvent> events) {
        this.events = List.copyOf(events);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public Concern concern() {
        return Concern.EVENT_SEQUENCE;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EventSequence && events.equals(((EventSequence) o).events));
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    /**
     * Accumulates events during a single import pass.
     */
    public static final class Builder {
        private final List<PositionedEvent> events = new ArrayList<>();

        public Builder add(int layer, int position, int depth, int block, ControlEvent event) {
            events.add(new PositionedEvent(layer, position, depth, block, event));
            return this;
        }

        public boolean isEmpty() {
            return events.isEmpty();
        }

        public EventSequence build() {
            return new EventSequence(events);
        }
    }
}
