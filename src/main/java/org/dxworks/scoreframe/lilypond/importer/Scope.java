package org.dxworks.scoreframe.lilypond.importer;

import org.dxworks.scoreframe.ext.GraceInfo;
import org.dxworks.scoreframe.mei.ControlElement;

/**
 * One open block during the import walk. Span scopes carry the control element whose start and end
 * are filled in when the block closes.
 */
final class Scope {

    enum Kind {
        TUPLET,
        GRACE,
        REPEAT,
        ENDING
    }

    final Kind kind;
    final ControlElement span;      // null for grace scopes
    final GraceInfo grace;          // only for grace scopes
    String firstEventId;
    String lastEventId;

    private Scope(Kind kind, ControlElement span, GraceInfo grace) {
        this.kind = kind;
        this.span = span;
        this.grace = grace;
    }

    static Scope span(Kind kind, ControlElement span) {
        return new Scope(kind, span, null);
    }

    static Scope grace(GraceInfo grace) {
        return new Scope(Kind.GRACE, null, grace);
    }

    boolean isEmpty() {
        return firstEventId == null;
    }
}
