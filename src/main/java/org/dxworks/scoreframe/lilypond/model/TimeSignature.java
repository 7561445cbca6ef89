package org.dxworks.scoreframe.lilypond.model;

public class TimeSignature extends Music {
    public int numerator;
    public int denominator;

    public TimeSignature(int numerator, int denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }
}
