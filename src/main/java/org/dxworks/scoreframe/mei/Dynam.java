package org.dxworks.scoreframe.mei;

public class Dynam extends ControlElement {
    public String text;

    public Dynam() {
        super("dynam");
    }
}
