package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

public class SequentialMusic extends Music {
    public List<Music> items = new ArrayList<>();

    public SequentialMusic() {
    }

    public SequentialMusic(List<Music> items) {
        this.items = items;
    }
}
