package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks a staff whose layers were written as plain {@code << { } { } >>} branches instead of
 * {@code \\}-separated voices.
 */
public final class PlainSimultaneousMarker implements ExtensionEntry {
    public static final PlainSimultaneousMarker INSTANCE = new PlainSimultaneousMarker();

    private PlainSimultaneousMarker() {
    }

    @Override
    public Concern concern() {
        return Concern.PLAIN_SIMULTANEOUS;
    }

    @JsonValue
    @Override
    public String toString() {
        return "plain-simultaneous";
    }
}
