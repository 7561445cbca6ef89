package org.dxworks.scoreframe.mei;

public class Hairpin extends ControlElement {
    public String form; // cres, dim

    public Hairpin() {
        super("hairpin");
    }
}
