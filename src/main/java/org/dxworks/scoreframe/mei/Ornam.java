package org.dxworks.scoreframe.mei;

public class Ornam extends ControlElement {
    public String text;

    public Ornam() {
        super("ornam");
    }
}
