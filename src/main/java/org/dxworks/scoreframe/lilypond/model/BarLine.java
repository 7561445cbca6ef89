package org.dxworks.scoreframe.lilypond.model;

public class BarLine extends Music {
    public String style;

    public BarLine(String style) {
        this.style = style;
    }
}
