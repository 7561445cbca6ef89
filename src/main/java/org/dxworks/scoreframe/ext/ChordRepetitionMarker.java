package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks a chord that was written as {@code q}.
 */
public final class ChordRepetitionMarker implements ExtensionEntry {
    public static final ChordRepetitionMarker INSTANCE = new ChordRepetitionMarker();

    private ChordRepetitionMarker() {
    }

    @Override
    public Concern concern() {
        return Concern.CHORD_REPETITION;
    }

    @JsonValue
    @Override
    public String toString() {
        return "chord-repetition";
    }
}
