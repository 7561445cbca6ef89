package org.dxworks.scoreframe.lilypond.model;

import org.dxworks.scoreframe.ext.Fraction;

public class AfterGraceMusic extends Music {
    public Fraction fraction;
    public Music main;
    public Music grace;

    public AfterGraceMusic(Fraction fraction, Music main, Music grace) {
        this.fraction = fraction;
        this.main = main;
        this.grace = grace;
    }
}
