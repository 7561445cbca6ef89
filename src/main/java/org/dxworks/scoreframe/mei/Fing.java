package org.dxworks.scoreframe.mei;

public class Fing extends ControlElement {
    public String text;

    public Fing() {
        super("fing");
    }
}
