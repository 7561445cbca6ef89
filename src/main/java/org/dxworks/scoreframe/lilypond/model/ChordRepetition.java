package org.dxworks.scoreframe.lilypond.model;

/**
 * {@code q}: the previous chord's pitches again.
 */
public class ChordRepetition extends RhythmicEvent {
}
