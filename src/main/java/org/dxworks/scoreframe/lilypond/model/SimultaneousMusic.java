package org.dxworks.scoreframe.lilypond.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code << >>}. With {@code \\} separators each item is one voice.
 */
public class SimultaneousMusic extends Music {
    public List<Music> items = new ArrayList<>();
    public boolean voiceSeparated;
}
