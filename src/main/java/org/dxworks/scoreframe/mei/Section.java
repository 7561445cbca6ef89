package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

public class Section extends MeiElement {
    public List<Staff> staves = new ArrayList<>();
    public List<ControlElement> controlEvents = new ArrayList<>();

    public Section() {
        super("section");
    }
}
