package org.dxworks.scoreframe.mei;

public class Trill extends ControlElement {
    public Trill() {
        super("trill");
    }
}
