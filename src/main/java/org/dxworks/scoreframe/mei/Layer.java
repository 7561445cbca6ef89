package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

public class Layer extends MeiElement {
    public int n;
    public List<LayerElement> children = new ArrayList<>();

    public Layer() {
        super("layer");
    }
}
