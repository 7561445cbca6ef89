package org.dxworks.scoreframe;

public enum ScoreFormat {
    LILYPOND("LilyPond");

    private final String name;

    ScoreFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
