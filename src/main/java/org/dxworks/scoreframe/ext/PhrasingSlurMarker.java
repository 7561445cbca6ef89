package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks a slur that was written with {@code \( \)}.
 */
public final class PhrasingSlurMarker implements ExtensionEntry {
    public static final PhrasingSlurMarker INSTANCE = new PhrasingSlurMarker();

    private PhrasingSlurMarker() {
    }

    @Override
    public Concern concern() {
        return Concern.PHRASING_SLUR;
    }

    @JsonValue
    @Override
    public String toString() {
        return "phrasing-slur";
    }
}
