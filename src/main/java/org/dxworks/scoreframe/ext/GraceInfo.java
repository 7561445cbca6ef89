package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Grace role of a note. Only after-graces carry a fraction, and only when one was written.
 */
public final class GraceInfo implements ExtensionEntry {

    public enum Kind {
        GRACE,
        ACCIACCATURA,
        APPOGGIATURA,
        AFTER_GRACE
    }

    public final Kind kind;
    public final Fraction fraction; // nullable

    private GraceInfo(Kind kind, Fraction fraction) {
        this.kind = kind;
        this.fraction = fraction;
    }

    public static GraceInfo of(Kind kind) {
        if (kind == Kind.AFTER_GRACE) {
            return afterGrace(null);
        }
        return new GraceInfo(kind, null);
    }

    public static GraceInfo afterGrace(Fraction fraction) {
        return new GraceInfo(Kind.AFTER_GRACE, fraction);
    }

    @JsonIgnore
    public boolean isAfterGrace() {
        return kind == Kind.AFTER_GRACE;
    }

    @Override
    public Concern concern() {
        return Concern.GRACE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraceInfo)) return false;
        GraceInfo other = (GraceInfo) o;
        return kind == other.kind && Objects.equals(fraction, other.fraction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fraction);
    }
}
