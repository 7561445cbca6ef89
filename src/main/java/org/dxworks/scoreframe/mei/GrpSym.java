package org.dxworks.scoreframe.mei;

/**
 * Explicit group symbol element. MusicXML has no counterpart for it inside a part list.
 */
public class GrpSym extends MeiElement implements StaffGrpChild {
    public String symbol;

    public GrpSym() {
        super("grpSym");
    }
}
