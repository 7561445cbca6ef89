package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Kind and source spelling of a marking lowered to a generic directive. The value is the script name
 * ("staccato", "upbow"), with abbreviations already expanded, or the string number.
 */
public final class ArticulationInfo implements ExtensionEntry {

    public enum Kind {
        ARTICULATION,
        FINGERING,
        STRING_NUMBER
    }

    public final Kind kind;
    public final String value;
    public final Direction direction;

    public ArticulationInfo(Kind kind, String value, Direction direction) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.direction = direction == null ? Direction.NEUTRAL : direction;
    }

    @Override
    public Concern concern() {
        return Concern.ARTICULATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArticulationInfo)) return false;
        ArticulationInfo other = (ArticulationInfo) o;
        return kind == other.kind && value.equals(other.value) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, direction);
    }
}
