package org.dxworks.scoreframe.musicxml.model;

/**
 * Part shell created from a score-part: identity, staff count and the part symbol of multi-staff parts.
 */
public class Part {
    public String id;
    public int staves = 1;
    public PartSymbol partSymbol;

    public Part(String id) {
        this.id = id;
    }
}
