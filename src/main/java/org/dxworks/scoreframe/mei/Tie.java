package org.dxworks.scoreframe.mei;

public class Tie extends ControlElement {
    public Tie() {
        super("tie");
    }
}
