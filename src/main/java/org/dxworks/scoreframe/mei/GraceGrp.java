package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

public class GraceGrp extends LayerElement {
    public static final String ATTACH_PRE = "pre";
    public static final String ATTACH_POST = "post";

    public String attach;
    public String grace;
    public List<LayerElement> children = new ArrayList<>();

    public GraceGrp() {
        super("graceGrp");
    }
}
