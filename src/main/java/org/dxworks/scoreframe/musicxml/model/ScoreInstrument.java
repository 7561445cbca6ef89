package org.dxworks.scoreframe.musicxml.model;

/**
 * A score-instrument together with its midi-instrument assignment.
 */
public class ScoreInstrument {
    public String id;
    public String instrumentName;
    public String instrumentAbbreviation;
    public String instrumentSound;
    public Integer midiChannel;
    public Integer midiProgram;
}
