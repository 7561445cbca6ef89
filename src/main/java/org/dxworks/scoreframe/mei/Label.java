package org.dxworks.scoreframe.mei;

public class Label extends MeiElement implements StaffGrpChild {
    public String text;

    public Label() {
        super("label");
    }

    public Label(String text) {
        this();
        this.text = text;
    }
}
