package org.dxworks.scoreframe.lilypond.model;

public class KeySignature extends Music {
    public String tonic; // as written, e.g. "bes"
    public String mode;  // major, minor, dorian, ...

    public KeySignature(String tonic, String mode) {
        this.tonic = tonic;
        this.mode = mode;
    }
}
