package org.dxworks.scoreframe.mei;

public class Turn extends ControlElement {
    public String form; // upper, lower

    public Turn() {
        super("turn");
    }
}
