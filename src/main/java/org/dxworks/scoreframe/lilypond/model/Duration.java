package org.dxworks.scoreframe.lilypond.model;

import java.util.Objects;
import java.util.Set;

public class Duration {
    public static final Set<Integer> BASES = Set.of(1, 2, 4, 8, 16, 32, 64, 128);

    public int base;
    public int dots;

    public Duration(int base, int dots) {
        this.base = base;
        this.dots = dots;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Duration)) return false;
        Duration other = (Duration) o;
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
