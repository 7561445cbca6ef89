package org.dxworks.scoreframe.lilypond.model;

import java.util.Objects;

/**
 * A written pitch. {@code octave} counts octave marks: 0 is the octave below middle C, {@code c'} is 1.
 */
public class Pitch {
    private static final String STEPS = "cdefgab";

    public char step;
    public int alter;
    public int octave;
    public boolean forcedAccidental;
    public boolean cautionaryAccidental;

    public Pitch(char step, int alter, int octave) {
        this.step = step;
        this.alter = alter;
        this.octave = octave;
    }

    public Pitch copy() {
        Pitch copy = new Pitch(step, alter, octave);
        copy.forcedAccidental = forcedAccidental;
        copy.cautionaryAccidental = cautionaryAccidental;
        return copy;
    }

    /**
     * Scientific octave number, 4 for middle C.
     */
    public int absoluteOctave() {
        return 3 + octave;
    }

    /**
     * Resolves a pitch written in relative mode. Without marks the note lands within a fourth of the
     * reference; each mark then moves it by an octave.
     */
    public Pitch resolveRelative(char refStep, int refOctave) {
        int refIdx = stepIndex(refStep);
        int stepDiff = normalizedStepDiff(stepIndex(step) - refIdx);
        int target = refIdx + stepDiff;
        int base = refOctave;
        if (target < 0) base--;
        else if (target >= 7) base++;
        Pitch resolved = copy();
        resolved.octave = base + octave;
        return resolved;
    }

    /**
     * Octave marks needed to write this absolute pitch relative to the reference.
     */
    public int toRelativeMarks(char refStep, int refOctave) {
        int refIdx = stepIndex(refStep);
        int target = refIdx + normalizedStepDiff(stepIndex(step) - refIdx);
        int base = refOctave;
        if (target < 0) base--;
        else if (target >= 7) base++;
        return octave - base;
    }

    private static int normalizedStepDiff(int diff) {
        if (diff > 3) return diff - 7;
        if (diff < -3) return diff + 7;
        return diff;
    }

    public static int stepIndex(char step) {
        int idx = STEPS.indexOf(step);
        if (idx < 0) {
            throw new IllegalArgumentException("Not a pitch step: " + step);
        }
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pitch)) return false;
        Pitch other = (Pitch) o;
        return step == other.step && alter == other.alter && octave == other.octave
                && forcedAccidental == other.forcedAccidental
                && cautionaryAccidental == other.cautionaryAccidental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, alter, octave, forcedAccidental, cautionaryAccidental);
    }
}
