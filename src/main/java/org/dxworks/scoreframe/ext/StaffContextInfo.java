package org.dxworks.scoreframe.ext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * How a staff or staff group was introduced in LilyPond: {@code \new} or {@code \context}, the context
 * type, an optional context name and the {@code \with} assignments that have no native field.
 * Assignment values are kept as written (strings quoted).
 */
public final class StaffContextInfo implements ExtensionEntry {
    public final String keyword;
    public final String contextType;
    public final String name; // nullable
    public final Map<String, String> withAssignments;

    public StaffContextInfo(String keyword, String contextType, String name, Map<String, String> withAssignments) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.contextType = Objects.requireNonNull(contextType, "contextType");
        this.name = name;
        this.withAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(withAssignments));
    }

    @Override
    public Concern concern() {
        return Concern.STAFF_CONTEXT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaffContextInfo)) return false;
        StaffContextInfo other = (StaffContextInfo) o;
        return keyword.equals(other.keyword) && contextType.equals(other.contextType)
                && Objects.equals(name, other.name) && withAssignments.equals(other.withAssignments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, contextType, name, withAssignments);
    }
}
