package org.dxworks.scoreframe.lilypond.model;

public class RestEvent extends RhythmicEvent {
    public boolean skip;
    public Pitch position; // pitched rest, c4\rest

    public RestEvent(boolean skip) {
        this.skip = skip;
    }
}
