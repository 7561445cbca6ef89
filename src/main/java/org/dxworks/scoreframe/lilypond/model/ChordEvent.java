package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

public class ChordEvent extends RhythmicEvent {
    public List<Pitch> pitches = new ArrayList<>();
}
