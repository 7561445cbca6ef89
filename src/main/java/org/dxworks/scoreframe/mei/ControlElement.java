package org.dxworks.scoreframe.mei;

/**
 * Control events live outside layers and point at layer content by identity.
 */
public abstract class ControlElement extends MeiElement {
    public String startid;
    public String endid;
    public Integer staff;
    public String place; // above, below

    protected ControlElement(String element) {
        super(element);
    }
}
