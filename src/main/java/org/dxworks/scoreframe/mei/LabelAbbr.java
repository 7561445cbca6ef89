package org.dxworks.scoreframe.mei;

public class LabelAbbr extends MeiElement implements StaffGrpChild {
    public String text;

    public LabelAbbr() {
        super("labelAbbr");
    }

    public LabelAbbr(String text) {
        this();
        this.text = text;
    }
}
