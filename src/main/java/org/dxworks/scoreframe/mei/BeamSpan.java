package org.dxworks.scoreframe.mei;

public class BeamSpan extends ControlElement {
    public BeamSpan() {
        super("beamSpan");
    }
}
