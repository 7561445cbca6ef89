package org.dxworks.scoreframe.ext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File-level LilyPond detail: the version statement, whether the music sat in a {@code \score} block,
 * header fields other than title and composer, and the {@code \layout}/{@code \midi} blocks.
 */
public final class FormatOriginInfo implements ExtensionEntry {
    public final String version; // nullable
    public final boolean scoreBlock;
    public final Map<String, String> headerFields;
    public final List<OutputDef> outputDefs;

    public FormatOriginInfo(String version, boolean scoreBlock, Map<String, String> headerFields,
                            List<OutputDef> outputDefs) {
        this.version = version;
        this.scoreBlock = scoreBlock;
        this.headerFields = Collections.unmodifiableMap(new LinkedHashMap<>(headerFields));
        this.outputDefs = List.copyOf(outputDefs);
    }

    @Override
    public Concern concern() {
        return Concern.FORMAT_ORIGIN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatOriginInfo)) return false;
        FormatOriginInfo other = (FormatOriginInfo) o;
        return scoreBlock == other.scoreBlock && Objects.equals(version, other.version)
                && headerFields.equals(other.headerFields) && outputDefs.equals(other.outputDefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, scoreBlock, headerFields, outputDefs);
    }

    public static final class OutputDef {
        public final String kind;
        public final Map<String, String> assignments;

        public OutputDef(String kind, Map<String, String> assignments) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof OutputDef)) return false;
            OutputDef other = (OutputDef) o;
            return kind.equals(other.kind) && assignments.equals(other.assignments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, assignments);
        }
    }
}
