package org.dxworks.scoreframe.mei;

public class Space extends LayerElement {
    public int dur;
    public int dots;

    public Space() {
        super("space");
    }
}
