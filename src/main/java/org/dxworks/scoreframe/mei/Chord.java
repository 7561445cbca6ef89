package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

public class Chord extends LayerElement {
    public List<Note> notes = new ArrayList<>();
    public int dur;
    public int dots;
    public String grace;

    public Chord() {
        super("chord");
    }
}
