package org.dxworks.scoreframe.musicxml.model;

import java.util.ArrayList;
import java.util.List;

public class PartList {
    public List<PartListItem> items = new ArrayList<>();

    public List<ScorePart> scoreParts() {
        List<ScorePart> parts = new ArrayList<>();
        for (PartListItem item : items) {
            if (item instanceof ScorePart scorePart) {
                parts.add(scorePart);
            }
        }
        return parts;
    }
}
