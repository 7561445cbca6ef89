package org.dxworks.scoreframe.lilypond.model;

public class BarCheck extends Music {
}
