package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * A control event placed among the layer events of its staff.
 * <p>
 * {@code position} counts the note, chord and rest events emitted before it in the staff, across
 * layers. {@code depth} is the number of enclosing tuplet, grace, repeat and ending scopes, and
 * {@code block} the number of such scopes opened in the staff so far. Two events at the same
 * position and depth still differ by block when one closes a block and the other opens the next.
 */
public final class PositionedEvent {
    public final int layer;
    public final int position;
    public final int depth;
    public final int block;
    public final ControlEvent event;

    public PositionedEvent(int layer, int position, int depth, int block, ControlEvent event) {
        if (layer < 1) {
            throw new IllegalArgumentException("Layer numbers start at 1");
        }
        if (position < 0 || depth < 0 || block < 0) {
            throw new IllegalArgumentException("Position, depth and block must not be negative");
        }
        this.layer = layer;
        this.position = position;
        this.depth = depth;
        this.block = block;
        this.event = Objects.requireNonNull(event, "event");
    }

    /**
     * Whether the event is replayed at this point of the given layer.
     */
    public boolean isAt(int layer, int position, int depth, int block) {
        return this.layer == layer && this.position == position && this.depth == depth && this.block == block;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionedEvent)) return false;
        PositionedEvent other = (PositionedEvent) o;
        return layer == other.layer && position == other.position && depth == other.depth
                && block == other.block && event.equals(other.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layer, position, depth, block, event);
    }
}
