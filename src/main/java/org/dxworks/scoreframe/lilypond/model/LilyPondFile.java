package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

public class LilyPondFile {
    public String version;
    public List<Assignment> header; // null when there is no \header block
    public boolean scoreBlock;
    public List<OutputDef> outputDefs = new ArrayList<>();
    public List<Music> music = new ArrayList<>();
}
