package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * A LilyPond-style duration: base denominator (1, 2, 4, ...) plus augmentation dots.
 */
public final class DurationInfo {
    public final int base;
    public final int dots;

    public DurationInfo(int base, int dots) {
        this.base = base;
        this.dots = dots;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DurationInfo)) return false;
        DurationInfo other = (DurationInfo) o;
        return base == other.base && dots == other.dots;
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, dots);
    }

    @Override
    public String toString() {
        return base + ".".repeat(dots);
    }
}
