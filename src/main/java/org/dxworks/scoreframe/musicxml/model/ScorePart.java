package org.dxworks.scoreframe.musicxml.model;

import java.util.ArrayList;
import java.util.List;

public class ScorePart implements PartListItem {
    public final String element = "score-part";
    public String id;
    public String partName;
    public String partAbbreviation;
    public List<ScoreInstrument> scoreInstruments = new ArrayList<>();

    public ScorePart(String id, String partName) {
        this.id = id;
        this.partName = partName;
    }
}
