package org.dxworks.scoreframe.mei;

public class TupletSpan extends ControlElement {
    public int num;
    public int numbase;

    public TupletSpan() {
        super("tupletSpan");
    }
}
