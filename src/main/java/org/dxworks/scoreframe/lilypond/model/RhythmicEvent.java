package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the events that take up time: notes, chords, chord repetitions, rests and skips.
 * A null duration inherits the previous one.
 */
public abstract class RhythmicEvent extends Music {
    public Duration duration;
    public Integer tremolo; // null without ':'; 0 for a bare ':'
    public List<PostEvent> postEvents = new ArrayList<>();
}
