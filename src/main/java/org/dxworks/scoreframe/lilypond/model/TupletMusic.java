package org.dxworks.scoreframe.lilypond.model;

/**
 * {@code \tuplet n/d [span] body}. {@code \times} is stored here with the ratio inverted.
 */
public class TupletMusic extends Music {
    public int numerator;
    public int denominator;
    public Duration spanDuration;
    public Music body;

    public TupletMusic(int numerator, int denominator, Duration spanDuration, Music body) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.spanDuration = spanDuration;
        this.body = body;
    }
}
