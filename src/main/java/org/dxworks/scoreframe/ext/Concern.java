package org.dxworks.scoreframe.ext;

import java.util.Optional;

/**
 * Names of the extension store concerns. Lookups are keyed by element identity plus one of these.
 */
public enum Concern {
    ARTICULATION("articulation"),
    ORNAMENT("ornament"),
    TREMOLO("tremolo"),
    TUPLET("tuplet"),
    GRACE("grace"),
    REPEAT("repeat"),
    ENDING("ending"),
    CHORD_REPETITION("chord-repetition"),
    EVENT_SEQUENCE("event-sequence"),
    PITCH_CONTEXT("pitch-context"),
    STAFF_CONTEXT("staff-context"),
    PHRASING_SLUR("phrasing-slur"),
    FORMAT_ORIGIN("format-origin"),
    PART_SYMBOL("part-symbol"),
    INSTRUMENT("instrument"),
    ENCLOSING_GRACE("enclosing-grace"),
    PLAIN_SIMULTANEOUS("plain-simultaneous");

    private final String name;

    Concern(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<Concern> fromName(String name) {
        for (Concern concern : values()) {
            if (concern.name.equals(name)) {
                return Optional.of(concern);
            }
        }
        return Optional.empty();
    }
}
