package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

public class Staff extends MeiElement {
    public int n;
    public List<Layer> layers = new ArrayList<>();

    public Staff() {
        super("staff");
    }
}
