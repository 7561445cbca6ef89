package org.dxworks.scoreframe.mei;

/**
 * Base of the hand-written MEI node subset. {@code element} is the MEI tag name.
 */
public abstract class MeiElement {
    public final String element;
    public String xmlId;

    protected MeiElement(String element) {
        this.element = element;
    }
}
