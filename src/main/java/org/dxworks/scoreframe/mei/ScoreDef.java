package org.dxworks.scoreframe.mei;

public class ScoreDef extends MeiElement {
    public StaffGrp staffGrp; // root group, bare container unless it carries attributes

    public ScoreDef() {
        super("scoreDef");
    }
}
