package org.dxworks.scoreframe.lilypond.model;

public class ClefChange extends Music {
    public String name;

    public ClefChange(String name) {
        this.name = name;
    }
}
