package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Records that a staff was written in relative octave mode. Pitches in the common tree are always
 * absolute; the reference is needed to write them back relative. A null step means {@code \relative}
 * was used without an explicit reference pitch.
 */
public final class PitchContextInfo implements ExtensionEntry {
    public final Character referenceStep;
    public final int referenceAlter;
    public final int referenceOctave; // octave marks, 0 = the octave below middle C

    public PitchContextInfo(Character referenceStep, int referenceAlter, int referenceOctave) {
        this.referenceStep = referenceStep;
        this.referenceAlter = referenceAlter;
        this.referenceOctave = referenceOctave;
    }

    public static PitchContextInfo withoutReference() {
        return new PitchContextInfo(null, 0, 0);
    }

    public boolean hasReference() {
        return referenceStep != null;
    }

    @Override
    public Concern concern() {
        return Concern.PITCH_CONTEXT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PitchContextInfo)) return false;
        PitchContextInfo other = (PitchContextInfo) o;
        return Objects.equals(referenceStep, other.referenceStep)
                && referenceAlter == other.referenceAlter
                && referenceOctave == other.referenceOctave;
    }

    @Override
    public int hashCode() {
        return Objects.hash(referenceStep, referenceAlter, referenceOctave);
    }
}
