package org.dxworks.scoreframe.lilypond.model;

import org.dxworks.scoreframe.ext.Direction;

import java.util.Objects;

/**
 * Something written after a note or chord and attached to it.
 * {@code name} holds the script or dynamic name, the abbreviation character, the fingering digit or
 * the string number, depending on the kind.
 */
public class PostEvent {

    public enum Kind {
        TIE,
        SLUR_START,
        SLUR_END,
        PHRASING_SLUR_START,
        PHRASING_SLUR_END,
        BEAM_START,
        BEAM_END,
        CRESCENDO,
        DECRESCENDO,
        HAIRPIN_END,
        DYNAMIC,
        SCRIPT,
        ABBREVIATED_SCRIPT,
        FINGERING,
        STRING_NUMBER
    }

    public Kind kind;
    public Direction direction = Direction.NEUTRAL;
    public String name;

    public PostEvent(Kind kind) {
        this.kind = kind;
    }

    public PostEvent(Kind kind, Direction direction, String name) {
        this.kind = kind;
        this.direction = direction;
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostEvent)) return false;
        PostEvent other = (PostEvent) o;
        return kind == other.kind && direction == other.direction && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, direction, name);
    }
}
