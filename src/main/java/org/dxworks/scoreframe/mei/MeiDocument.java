package org.dxworks.scoreframe.mei;

public class MeiDocument extends MeiElement {
    public MeiHead head = new MeiHead();
    public ScoreDef scoreDef = new ScoreDef();
    public Section section = new Section();

    public MeiDocument() {
        super("mei");
    }
}
