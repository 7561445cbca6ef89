package org.dxworks.scoreframe.mei;

public class Fermata extends ControlElement {
    public String shape; // curved, angular, square

    public Fermata() {
        super("fermata");
    }
}
