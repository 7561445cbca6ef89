package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks a grace group written around tuplet or repeat blocks that cover exactly its notes, as in
 * {@code \grace \tuplet 3/2 { ... }}. Without it such blocks enclose the grace group.
 */
public final class EnclosingGraceMarker implements ExtensionEntry {
    public static final EnclosingGraceMarker INSTANCE = new EnclosingGraceMarker();

    private EnclosingGraceMarker() {
    }

    @Override
    public Concern concern() {
        return Concern.ENCLOSING_GRACE;
    }

    @JsonValue
    @Override
    public String toString() {
        return "enclosing-grace";
    }
}
