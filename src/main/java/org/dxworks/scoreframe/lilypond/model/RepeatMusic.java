package org.dxworks.scoreframe.lilypond.model;

import org.dxworks.scoreframe.ext.RepeatInfo;

import java.util.ArrayList;
import java.util.List;

public class RepeatMusic extends Music {
    public RepeatInfo.RepeatType kind;
    public int count;
    public Music body;
    public List<Music> alternatives = new ArrayList<>();

    public RepeatMusic(RepeatInfo.RepeatType kind, int count, Music body) {
        this.kind = kind;
        this.count = count;
        this.body = body;
    }
}
