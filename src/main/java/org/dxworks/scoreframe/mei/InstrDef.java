package org.dxworks.scoreframe.mei;

public class InstrDef extends MeiElement {
    public String midiInstrname;
    public Integer midiInstrnum;

    public InstrDef() {
        super("instrDef");
    }
}
