package org.dxworks.scoreframe.lilypond.model;

public class RelativeMusic extends Music {
    public Pitch reference; // nullable
    public Music body;

    public RelativeMusic(Pitch reference, Music body) {
        this.reference = reference;
        this.body = body;
    }
}
