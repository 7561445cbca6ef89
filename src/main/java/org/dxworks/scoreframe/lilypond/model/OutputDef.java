package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A \layout or \midi block.
 */
public class OutputDef {
    public String kind;
    public List<Assignment> assignments = new ArrayList<>();

    public OutputDef(String kind) {
        this.kind = kind;
    }
}
