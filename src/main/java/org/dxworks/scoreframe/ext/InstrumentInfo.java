package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Score-instrument detail keyed by an instrument definition. Only the MIDI instrument name is native.
 */
public final class InstrumentInfo implements ExtensionEntry {
    public final String name;
    public final String abbreviation;
    public final String sound;
    public final Integer midiChannel;
    public final Integer midiProgram;

    public InstrumentInfo(String name, String abbreviation, String sound, Integer midiChannel, Integer midiProgram) {
        this.name = Objects.requireNonNull(name, "name");
        this.abbreviation = abbreviation;
        this.sound = sound;
        this.midiChannel = midiChannel;
        this.midiProgram = midiProgram;
    }

    @Override
    public Concern concern() {
        return Concern.INSTRUMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstrumentInfo)) return false;
        InstrumentInfo other = (InstrumentInfo) o;
        return name.equals(other.name) && Objects.equals(abbreviation, other.abbreviation)
                && Objects.equals(sound, other.sound) && Objects.equals(midiChannel, other.midiChannel)
                && Objects.equals(midiProgram, other.midiProgram);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, abbreviation, sound, midiChannel, midiProgram);
    }
}
