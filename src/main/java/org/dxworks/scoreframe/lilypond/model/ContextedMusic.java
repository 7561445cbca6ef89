package org.dxworks.scoreframe.lilypond.model;

import java.util.List;

/**
 * {@code \new Type = "name" \with { ... } music}, or the same with {@code \context}.
 */
public class ContextedMusic extends Music {
    public String keyword;
    public String contextType;
    public String name;
    public List<Assignment> with; // null without a \with block
    public Music music;

    public ContextedMusic(String keyword, String contextType) {
        this.keyword = keyword;
        this.contextType = contextType;
    }
}
