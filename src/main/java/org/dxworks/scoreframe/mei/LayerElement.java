package org.dxworks.scoreframe.mei;

public abstract class LayerElement extends MeiElement {
    protected LayerElement(String element) {
        super(element);
    }
}
