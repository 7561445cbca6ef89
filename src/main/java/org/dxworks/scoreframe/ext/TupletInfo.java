package org.dxworks.scoreframe.ext;

import java.util.Objects;

public final class TupletInfo implements ExtensionEntry {
    public final int numerator;
    public final int denominator;
    public final DurationInfo spanDuration; // nullable

    public TupletInfo(int numerator, int denominator, DurationInfo spanDuration) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.spanDuration = spanDuration;
    }

    @Override
    public Concern concern() {
        return Concern.TUPLET;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupletInfo)) return false;
        TupletInfo other = (TupletInfo) o;
        return numerator == other.numerator && denominator == other.denominator
                && Objects.equals(spanDuration, other.spanDuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator, spanDuration);
    }
}
