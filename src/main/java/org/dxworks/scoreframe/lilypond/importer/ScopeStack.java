package org.dxworks.scoreframe.lilypond.importer;

import org.dxworks.scoreframe.ext.GraceInfo;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Active tuplet, grace, repeat and ending scopes, innermost on top.
 */
final class ScopeStack {

    private final Deque<Scope> scopes = new ArrayDeque<>();

    void push(Scope scope) {
        scopes.push(scope);
    }

    Scope pop() {
        return scopes.pop();
    }

    int depth() {
        return scopes.size();
    }

    /**
     * Every open scope sees the event; the first one it sees is its start.
     */
    void recordEvent(String eventId) {
        for (Scope scope : scopes) {
            if (scope.firstEventId == null) {
                scope.firstEventId = eventId;
            }
            scope.lastEventId = eventId;
        }
    }

    Optional<GraceInfo> innermostGrace() {
        for (Scope scope : scopes) {
            if (scope.kind == Scope.Kind.GRACE) {
                return Optional.of(scope.grace);
            }
        }
        return Optional.empty();
    }
}
