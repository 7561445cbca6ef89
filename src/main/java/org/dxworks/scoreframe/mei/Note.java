package org.dxworks.scoreframe.mei;

public class Note extends LayerElement {
    public char pname;
    public int oct;       // 4 = octave of middle C
    public int alter;     // semitones, -2..2
    public boolean accidForced;
    public boolean accidCautionary;
    public Integer dur;   // null for chord members
    public int dots;
    public String grace;  // acc, unacc

    public Note() {
        super("note");
    }
}
