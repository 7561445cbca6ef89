package org.dxworks.scoreframe.mei;

public class Dir extends ControlElement {
    public String text;

    public Dir() {
        super("dir");
    }
}
