package org.dxworks.scoreframe.mei;

public class Mordent extends ControlElement {
    public String form; // upper, lower

    public Mordent() {
        super("mordent");
    }
}
