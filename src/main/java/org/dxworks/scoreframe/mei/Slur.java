package org.dxworks.scoreframe.mei;

public class Slur extends ControlElement {
    public Slur() {
        super("slur");
    }
}
