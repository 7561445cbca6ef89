package org.dxworks.scoreframe.lilypond.model;

public class NoteEvent extends RhythmicEvent {
    public Pitch pitch;

    public NoteEvent(Pitch pitch) {
        this.pitch = pitch;
    }
}
