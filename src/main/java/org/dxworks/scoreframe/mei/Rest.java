package org.dxworks.scoreframe.mei;

public class Rest extends LayerElement {
    public int dur;
    public int dots;
    public Character ploc; // vertical position of a pitched rest
    public Integer oloc;

    public Rest() {
        super("rest");
    }
}
